package forensic.damages.core.domain.model;

/**
 * Decedent's own consumption share in percent, per era. Era 1 covers the past (injury to trial),
 * era 2 the future.
 */
public record PersonalConsumption(double era1Pct, double era2Pct) {

  public static final PersonalConsumption NONE = new PersonalConsumption(0, 0);

  public static PersonalConsumption flat(double pct) {
    return new PersonalConsumption(pct, pct);
  }
}
