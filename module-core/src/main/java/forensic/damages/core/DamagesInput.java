package forensic.damages.core;

import forensic.damages.core.domain.model.CaseInfo;
import forensic.damages.core.domain.model.EarningsParams;
import forensic.damages.core.domain.model.HouseholdServices;
import forensic.damages.core.domain.model.LcpItem;
import forensic.damages.core.domain.model.ManualActuals;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One complete case as submitted for calculation.
 *
 * @param caseInfo case identification and dates
 * @param earningsParams earnings assumptions
 * @param actuals manually entered actual past earnings by calendar year
 * @param unionMode true when fringes are itemized flat amounts
 * @param householdServices household-services claim
 * @param lcpItems life-care-plan items
 * @param selectedScenario scenario id highlighted in reports, nullable
 * @param excludedScenarios scenario ids left out of reports
 * @param baseCalendarYear calendar year of the first future row in detailed schedules
 */
public record DamagesInput(
    CaseInfo caseInfo,
    EarningsParams earningsParams,
    ManualActuals actuals,
    boolean unionMode,
    HouseholdServices householdServices,
    List<LcpItem> lcpItems,
    String selectedScenario,
    Set<String> excludedScenarios,
    int baseCalendarYear) {

  public DamagesInput {
    Objects.requireNonNull(caseInfo, "caseInfo");
    Objects.requireNonNull(earningsParams, "earningsParams");
    actuals = actuals == null ? ManualActuals.none() : actuals;
    householdServices = householdServices == null ? HouseholdServices.INACTIVE : householdServices;
    lcpItems = lcpItems == null ? List.of() : List.copyOf(lcpItems);
    excludedScenarios = excludedScenarios == null ? Set.of() : Set.copyOf(excludedScenarios);
  }
}
