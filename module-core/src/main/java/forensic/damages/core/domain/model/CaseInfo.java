package forensic.damages.core.domain.model;

import java.time.LocalDate;

/**
 * Case identity and the dates every calculation is anchored to.
 *
 * <p>Dates are nullable: a missing date means "not yet entered" and produces a zeroed {@link
 * DateCalc} rather than an error.
 *
 * @param plaintiff plaintiff name
 * @param fileNumber case file number
 * @param attorney retaining attorney
 * @param lawFirm retaining firm
 * @param gender plaintiff gender (life/worklife table selection upstream)
 * @param dateOfBirth birth date, nullable
 * @param dateOfInjury injury (or death) date, nullable
 * @param dateOfTrial trial / valuation date, nullable
 * @param retirementAge assumed retirement age in years
 * @param lifeExpectancy remaining life expectancy in years
 * @param jurisdiction governing jurisdiction
 */
public record CaseInfo(
    String plaintiff,
    String fileNumber,
    String attorney,
    String lawFirm,
    String gender,
    LocalDate dateOfBirth,
    LocalDate dateOfInjury,
    LocalDate dateOfTrial,
    double retirementAge,
    double lifeExpectancy,
    String jurisdiction) {

  public static final double DEFAULT_RETIREMENT_AGE = 67;

  /** Minimal case carrying only the dates and retirement age the engine reads. */
  public static CaseInfo of(
      LocalDate dateOfBirth, LocalDate dateOfInjury, LocalDate dateOfTrial, double retirementAge) {
    return new CaseInfo(
        "", "", "", "", "", dateOfBirth, dateOfInjury, dateOfTrial, retirementAge, 0, "");
  }

  public boolean hasAllDates() {
    return dateOfBirth != null && dateOfInjury != null && dateOfTrial != null;
  }
}
