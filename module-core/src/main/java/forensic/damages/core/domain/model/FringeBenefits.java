package forensic.damages.core.domain.model;

/**
 * Fringe-benefit inputs. Standard mode reads {@code ratePct}; union mode sums the itemized annual
 * dollar amounts instead.
 */
public record FringeBenefits(
    boolean enabled,
    double ratePct,
    double pension,
    double healthWelfare,
    double annuity,
    double clothingAllowance,
    double otherBenefits) {

  public static final double DEFAULT_RATE_PCT = 21.5;

  public static FringeBenefits percentage(double ratePct) {
    return new FringeBenefits(true, ratePct, 0, 0, 0, 0, 0);
  }

  public static FringeBenefits itemized(
      double pension,
      double healthWelfare,
      double annuity,
      double clothingAllowance,
      double otherBenefits) {
    return new FringeBenefits(
        true, 0, pension, healthWelfare, annuity, clothingAllowance, otherBenefits);
  }

  public static FringeBenefits disabled() {
    return new FringeBenefits(false, 0, 0, 0, 0, 0, 0);
  }

  /** Annual union fringe package in dollars. */
  public double flatTotal() {
    return pension + healthWelfare + annuity + clothingAllowance + otherBenefits;
  }
}
