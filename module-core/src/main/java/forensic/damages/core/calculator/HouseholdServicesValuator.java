package forensic.damages.core.calculator;

import forensic.damages.core.domain.model.HouseholdServices;
import forensic.damages.core.domain.model.HouseholdServicesValuation;
import java.util.ArrayList;
import java.util.List;

/**
 * Replacement value of lost household services over {@code ceil(YFS)} years.
 *
 * <pre>
 * value(i) = hours × 52 × rate × (1 + g)^i
 * pv(i)    = value(i) × (1 + r)^-(i + 0.5)
 * </pre>
 */
public class HouseholdServicesValuator {

  /** Nominal and discounted value for one year of the horizon. */
  public record HouseholdCashFlow(int yearIndex, double value, double presentValue) {}

  public HouseholdServicesValuation value(
      HouseholdServices services, double yfs, boolean presentValueEnabled) {
    if (services == null || !services.active()) {
      return HouseholdServicesValuation.ZERO;
    }
    double nominal = 0;
    double pv = 0;
    for (HouseholdCashFlow flow : cashFlows(services, yfs, presentValueEnabled)) {
      nominal += flow.value();
      pv += flow.presentValue();
    }
    return new HouseholdServicesValuation(nominal, pv);
  }

  /** Year-by-year flows; empty when the claim is inactive or the horizon is non-positive. */
  public List<HouseholdCashFlow> cashFlows(
      HouseholdServices services, double yfs, boolean presentValueEnabled) {
    List<HouseholdCashFlow> flows = new ArrayList<>();
    if (services == null || !services.active()) {
      return flows;
    }
    int years = (int) Math.ceil(Math.max(0, yfs));
    double base = services.baseAnnualValue();
    for (int i = 0; i < years; i++) {
      double value = base * Discounting.growthFactor(services.growthRatePct(), i);
      double discount =
          Discounting.midYearFactor(services.discountRatePct(), i, presentValueEnabled);
      flows.add(new HouseholdCashFlow(i, value, value * discount));
    }
    return flows;
  }
}
