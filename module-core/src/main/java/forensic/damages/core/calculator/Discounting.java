package forensic.damages.core.calculator;

/**
 * Growth and mid-year discount factors shared by every valuator.
 *
 * <p>Mid-year convention: a cash flow in year index {@code i} (0-based) is discounted over {@code i
 * + 0.5} years, approximating receipt spread evenly through the year.
 */
public final class Discounting {

  private Discounting() {
    throw new UnsupportedOperationException("Utility class");
  }

  /** {@code (1 + r)^-(i + 0.5)} with {@code r = ratePct / 100}. */
  public static double midYearFactor(double ratePct, int yearIndex) {
    return 1 / Math.pow(1 + ratePct / 100, yearIndex + 0.5);
  }

  /** {@link #midYearFactor} when present value is enabled, otherwise 1. */
  public static double midYearFactor(double ratePct, int yearIndex, boolean presentValueEnabled) {
    return presentValueEnabled ? midYearFactor(ratePct, yearIndex) : 1;
  }

  /** {@code (1 + g)^i} with {@code g = ratePct / 100}. */
  public static double growthFactor(double ratePct, int years) {
    return Math.pow(1 + ratePct / 100, years);
  }
}
