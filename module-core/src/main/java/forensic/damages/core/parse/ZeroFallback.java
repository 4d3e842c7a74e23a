package forensic.damages.core.parse;

import java.util.OptionalDouble;

/** The engine's named default for absent numeric input: treat it as zero. */
public final class ZeroFallback {

  private ZeroFallback() {
    throw new UnsupportedOperationException("Utility class");
  }

  public static double orZero(OptionalDouble value) {
    return value.orElse(0.0);
  }

  public static double orZero(Double value) {
    return value == null || !Double.isFinite(value) ? 0.0 : value;
  }
}
