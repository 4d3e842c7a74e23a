package forensic.damages.core.domain.model;

import java.util.Objects;

/**
 * Inputs for the retirement-age comparison. Household and life-care-plan values are already
 * computed; they do not vary with the retirement age.
 */
public record ScenarioInput(
    EarningsCase earningsCase,
    HouseholdServices householdServices,
    HouseholdServicesValuation householdValuation,
    LcpValuation lcpValuation) {

  public ScenarioInput {
    Objects.requireNonNull(earningsCase, "earningsCase");
    householdServices = householdServices == null ? HouseholdServices.INACTIVE : householdServices;
    householdValuation =
        householdValuation == null ? HouseholdServicesValuation.ZERO : householdValuation;
    lcpValuation = lcpValuation == null ? LcpValuation.EMPTY : lcpValuation;
  }
}
