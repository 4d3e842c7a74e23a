package forensic.damages.core.parse;

import java.util.OptionalDouble;

/**
 * Parses user-entered money strings ("15000", "$15,000.50").
 *
 * <p>Blank, unparseable and non-finite input is reported as empty; callers choose their own
 * fallback (see {@link ZeroFallback}).
 */
public final class AmountParser {

  private AmountParser() {
    throw new UnsupportedOperationException("Utility class");
  }

  public static OptionalDouble parse(String raw) {
    if (raw == null) {
      return OptionalDouble.empty();
    }
    String cleaned = raw.replace("$", "").replace(",", "").trim();
    if (cleaned.isEmpty()) {
      return OptionalDouble.empty();
    }
    try {
      double value = Double.parseDouble(cleaned);
      return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    } catch (NumberFormatException e) {
      return OptionalDouble.empty();
    }
  }
}
