package forensic.damages.core.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive range of plan-year numbers (year 1 is the first year after valuation).
 *
 * <p>{@code first} is never below 1. A range with {@code last < first} is empty.
 */
public record YearRange(int first, int last) {

  public YearRange {
    first = Math.max(1, first);
  }

  /**
   * Resolves the effective range from the way plan items are authored: a start year, a duration,
   * and an optional explicit end year. The later of the explicit end and {@code start + duration -
   * 1} wins.
   *
   * @param startYear authored start year, values below 1 clamp to 1
   * @param durationYears authored duration
   * @param endYear explicit end year, nullable
   */
  public static YearRange of(int startYear, int durationYears, Integer endYear) {
    int first = Math.max(1, startYear);
    int fromDuration = first + durationYears - 1;
    int last = Math.max(endYear == null ? 0 : endYear, fromDuration);
    return new YearRange(first, last);
  }

  public int length() {
    return Math.max(0, last - first + 1);
  }

  public boolean isEmpty() {
    return length() == 0;
  }

  /** Years {@code first, first + step, …} up to {@code last}. */
  public List<Integer> every(int step) {
    List<Integer> years = new ArrayList<>();
    for (int t = 0; t < length(); t++) {
      if (t % step == 0) {
        years.add(first + t);
      }
    }
    return years;
  }
}
