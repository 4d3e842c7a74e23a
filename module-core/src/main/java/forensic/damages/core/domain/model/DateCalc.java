package forensic.damages.core.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Ages and spans derived from the case dates.
 *
 * <p>All spans are non-negative. {@link #EMPTY} is returned when any required date is missing.
 *
 * @param ageAtInjury age in years at the injury date
 * @param ageAtTrial age in years at the trial date
 * @param currentAge age in years at the evaluation date
 * @param pastYears injury-to-trial span in years (fractional)
 * @param derivedYfs Years to Final Separation
 */
public record DateCalc(
    double ageAtInjury, double ageAtTrial, double currentAge, double pastYears, double derivedYfs) {

  public static final DateCalc EMPTY = new DateCalc(0, 0, 0, 0, 0);

  public String ageAtInjuryDisplay() {
    return display(ageAtInjury);
  }

  public String ageAtTrialDisplay() {
    return display(ageAtTrial);
  }

  public String currentAgeDisplay() {
    return display(currentAge);
  }

  /** Same ages and past span, different separation horizon (scenario recomputation). */
  public DateCalc withDerivedYfs(double yfs) {
    return new DateCalc(ageAtInjury, ageAtTrial, currentAge, pastYears, yfs);
  }

  /** "0" for the empty result, one decimal (half up) otherwise. */
  private String display(double value) {
    return EMPTY.equals(this) ? "0" : oneDecimal(value);
  }

  private static String oneDecimal(double value) {
    return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).toPlainString();
  }
}
