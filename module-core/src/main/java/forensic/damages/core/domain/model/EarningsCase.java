package forensic.damages.core.domain.model;

import java.util.Objects;

/**
 * Everything the earnings engines need for one case.
 *
 * @param caseInfo case dates
 * @param params earnings assumptions
 * @param dateCalc spans derived from {@code caseInfo}
 * @param actuals manually entered actual past earnings
 * @param unionMode true when fringes are itemized flat amounts
 */
public record EarningsCase(
    CaseInfo caseInfo,
    EarningsParams params,
    DateCalc dateCalc,
    ManualActuals actuals,
    boolean unionMode) {

  public EarningsCase {
    Objects.requireNonNull(caseInfo, "caseInfo");
    Objects.requireNonNull(params, "params");
    Objects.requireNonNull(dateCalc, "dateCalc");
    actuals = actuals == null ? ManualActuals.none() : actuals;
  }
}
