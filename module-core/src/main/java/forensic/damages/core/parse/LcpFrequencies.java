package forensic.damages.core.parse;

import forensic.damages.core.domain.model.LcpFrequency;
import forensic.damages.core.domain.model.YearRange;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Converts the flat, string-typed authoring form of a plan item's timing ({@code freqType},
 * start/end year, duration, interval, custom-year list) into an {@link LcpFrequency}.
 */
public final class LcpFrequencies {

  public static final String ANNUAL = "annual";
  public static final String ONE_TIME = "onetime";
  public static final String RECURRING = "recurring";

  private LcpFrequencies() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * @param freqType {@code annual}, {@code onetime} or {@code recurring}
   * @param startYear authored start year, nullable (defaults to 1)
   * @param endYear authored end year, nullable
   * @param durationYears authored duration
   * @param recurrenceInterval interval for recurring items, nullable (defaults to 1)
   * @param useCustomYears whether {@code customYears} replaces the range
   * @param customYears explicit plan years, nullable
   * @return empty for an unknown {@code freqType} when custom years are not in use
   */
  public static Optional<LcpFrequency> fromLegacy(
      String freqType,
      Integer startYear,
      Integer endYear,
      int durationYears,
      Integer recurrenceInterval,
      boolean useCustomYears,
      Collection<Integer> customYears) {

    if (useCustomYears && customYears != null && !customYears.isEmpty()) {
      TreeSet<Integer> years = new TreeSet<>();
      customYears.stream().filter(y -> y != null).forEach(years::add);
      return Optional.of(new LcpFrequency.CustomYears(years));
    }

    int start = startYear == null ? 1 : startYear;
    YearRange range = YearRange.of(start, durationYears, endYear);
    String mode = freqType == null ? "" : freqType.trim().toLowerCase(Locale.ROOT);

    return switch (mode) {
      case ANNUAL -> Optional.of(new LcpFrequency.Annual(range));
      // a zero-length range is never incurred
      case ONE_TIME ->
          Optional.of(
              range.isEmpty()
                  ? new LcpFrequency.CustomYears(new TreeSet<>())
                  : new LcpFrequency.OneTime(range.first()));
      case RECURRING ->
          Optional.of(
              new LcpFrequency.Recurring(range, recurrenceInterval == null ? 1 : recurrenceInterval));
      default -> Optional.empty();
    };
  }
}
