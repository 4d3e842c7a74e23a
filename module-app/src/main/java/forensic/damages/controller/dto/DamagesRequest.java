package forensic.damages.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One case as submitted by the case-entry client.
 *
 * @param caseInfo case identification and dates
 * @param earnings earnings assumptions
 * @param pastActuals actual post-injury earnings by calendar year, as entered
 * @param unionMode itemized union fringe package instead of a fringe percentage
 * @param household household-services claim, nullable
 * @param lcpItems life-care-plan items, nullable
 * @param selectedScenario scenario highlighted in reports, nullable
 * @param excludedScenarios scenario ids left out of reports, nullable
 * @param baseCalendarYear calendar year of the first future schedule row, nullable
 */
public record DamagesRequest(
    @NotNull @Valid CaseInfoRequest caseInfo,
    @NotNull @Valid EarningsRequest earnings,
    Map<Integer, String> pastActuals,
    boolean unionMode,
    @Valid HouseholdRequest household,
    List<@Valid LcpItemRequest> lcpItems,
    String selectedScenario,
    Set<String> excludedScenarios,
    @Min(1900) @Max(2200) Integer baseCalendarYear) {}
