package forensic.damages.core.report;

import forensic.damages.core.domain.model.HouseholdServices;
import forensic.damages.core.domain.model.HouseholdServicesValuation;
import forensic.damages.core.domain.model.LcpValuation;
import forensic.damages.core.domain.model.Projection;

/** Headline figures of a calculation. */
public record SummaryMetrics(
    double totalPastLoss,
    double totalFuturePv,
    double totalEarningsLoss,
    double householdServicesPv,
    double lifeCarePlanPv,
    double grandTotal) {

  public static SummaryMetrics of(
      Projection projection,
      HouseholdServices householdServices,
      HouseholdServicesValuation householdValuation,
      LcpValuation lcpValuation,
      double grandTotal) {
    return new SummaryMetrics(
        projection.totalPastLoss(),
        projection.totalFuturePV(),
        projection.totalEarningsLoss(),
        householdServices.active() ? householdValuation.totalPresentValue() : 0,
        lcpValuation.totalPresentValue(),
        grandTotal);
  }
}
