package forensic.damages.core.calculator;

import forensic.damages.core.domain.model.HouseholdServices;
import forensic.damages.core.domain.model.HouseholdServicesValuation;
import forensic.damages.core.domain.model.LcpValuation;
import forensic.damages.core.domain.model.Projection;

/**
 * Sums the damages components.
 *
 * <pre>
 * grandTotal = past loss + future PV + household PV (active only) + life care plan PV
 * </pre>
 */
public class GrandTotalAggregator {

  public double aggregate(
      Projection projection,
      HouseholdServices householdServices,
      HouseholdServicesValuation householdValuation,
      LcpValuation lcpValuation) {
    return combine(
        projection.totalPastLoss(),
        projection.totalFuturePV(),
        householdServices,
        householdValuation,
        lcpValuation);
  }

  public double combine(
      double totalPastLoss,
      double totalFuturePv,
      HouseholdServices householdServices,
      HouseholdServicesValuation householdValuation,
      LcpValuation lcpValuation) {
    double household =
        householdServices != null && householdServices.active() && householdValuation != null
            ? householdValuation.totalPresentValue()
            : 0;
    double lcp = lcpValuation == null ? 0 : lcpValuation.totalPresentValue();
    return totalPastLoss + totalFuturePv + household + lcp;
  }
}
