package forensic.damages.core.calculator;

import forensic.damages.core.domain.model.CaseInfo;
import forensic.damages.core.domain.model.DateCalc;
import forensic.damages.core.domain.model.YfsOrigin;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Derives ages and time spans from the case dates.
 *
 * <p>A year is 365.25 days. Years to Final Separation is chronological (retirement age minus age at
 * the origin date) and deliberately not probability-weighted; weighting is the WLE's job.
 */
public class DateCalculator {

  static final double DAYS_PER_YEAR = 365.25;

  private final YfsOrigin yfsOrigin;

  public DateCalculator(YfsOrigin yfsOrigin) {
    this.yfsOrigin = Objects.requireNonNull(yfsOrigin, "yfsOrigin");
  }

  /**
   * @param caseInfo case dates and retirement age
   * @param today evaluation date for the current age
   * @return {@link DateCalc#EMPTY} when birth, injury or trial date is missing
   */
  public DateCalc calculate(CaseInfo caseInfo, LocalDate today) {
    if (caseInfo == null || !caseInfo.hasAllDates()) {
      return DateCalc.EMPTY;
    }
    LocalDate dob = caseInfo.dateOfBirth();
    double ageAtInjury = yearsBetween(dob, caseInfo.dateOfInjury());
    double ageAtTrial = yearsBetween(dob, caseInfo.dateOfTrial());
    double currentAge = today == null ? 0 : yearsBetween(dob, today);
    double pastYears = Math.max(0, yearsBetween(caseInfo.dateOfInjury(), caseInfo.dateOfTrial()));

    double originAge = yfsOrigin == YfsOrigin.TRIAL_DATE ? ageAtTrial : ageAtInjury;
    double yfs = Math.max(0, caseInfo.retirementAge() - originAge);

    return new DateCalc(ageAtInjury, ageAtTrial, currentAge, pastYears, yfs);
  }

  /** Age at injury, 0 when birth or injury date is missing. */
  public double ageAtInjury(CaseInfo caseInfo) {
    if (caseInfo == null || caseInfo.dateOfBirth() == null || caseInfo.dateOfInjury() == null) {
      return 0;
    }
    return yearsBetween(caseInfo.dateOfBirth(), caseInfo.dateOfInjury());
  }

  /** Age the YFS horizon is measured from. */
  public double originAge(DateCalc dateCalc) {
    return yfsOrigin == YfsOrigin.TRIAL_DATE ? dateCalc.ageAtTrial() : dateCalc.ageAtInjury();
  }

  public YfsOrigin yfsOrigin() {
    return yfsOrigin;
  }

  static double yearsBetween(LocalDate from, LocalDate to) {
    return ChronoUnit.DAYS.between(from, to) / DAYS_PER_YEAR;
  }
}
