package forensic.damages.core.format;

import java.text.NumberFormat;
import java.util.Locale;

/** Display formatting for damages figures (US conventions). */
public final class DamagesFormatter {

  private DamagesFormatter() {
    throw new UnsupportedOperationException("Utility class");
  }

  /** Whole-dollar currency, e.g. {@code $1,234,568}. */
  public static String usd(double amount) {
    NumberFormat format = NumberFormat.getCurrencyInstance(Locale.US);
    format.setMaximumFractionDigits(0);
    format.setMinimumFractionDigits(0);
    return format.format(amount);
  }

  /** A fraction as a percentage with two decimals, e.g. {@code 0.8 → 80.00%}. */
  public static String percent(double fraction) {
    return String.format(Locale.US, "%.2f%%", fraction * 100);
  }
}
