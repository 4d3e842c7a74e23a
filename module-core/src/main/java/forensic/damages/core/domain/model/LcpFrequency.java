package forensic.damages.core.domain.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * When a life-care-plan item is incurred. One payload shape per mode; the active plan years are
 * derived here so the valuator never branches on a mode string.
 */
public sealed interface LcpFrequency
    permits LcpFrequency.Annual,
        LcpFrequency.OneTime,
        LcpFrequency.Recurring,
        LcpFrequency.CustomYears {

  /** Active plan-year numbers (1-based), ascending and distinct. */
  List<Integer> activeYears();

  /** Every year of the range. */
  record Annual(YearRange range) implements LcpFrequency {
    @Override
    public List<Integer> activeYears() {
      return range.every(1);
    }
  }

  /** A single occurrence in {@code year}. */
  record OneTime(int year) implements LcpFrequency {
    public OneTime {
      year = Math.max(1, year);
    }

    @Override
    public List<Integer> activeYears() {
      return List.of(year);
    }
  }

  /** Every {@code intervalYears}-th year of the range, starting at its first year. */
  record Recurring(YearRange range, int intervalYears) implements LcpFrequency {
    public Recurring {
      intervalYears = Math.max(1, intervalYears);
    }

    @Override
    public List<Integer> activeYears() {
      return range.every(intervalYears);
    }
  }

  /**
   * Hand-picked plan years. Non-positive entries are dropped and duplicates collapse; no range or
   * duration applies.
   */
  record CustomYears(SortedSet<Integer> years) implements LcpFrequency {
    public CustomYears {
      TreeSet<Integer> cleaned = new TreeSet<>();
      for (Integer year : years) {
        if (year != null && year > 0) {
          cleaned.add(year);
        }
      }
      years = Collections.unmodifiableSortedSet(cleaned);
    }

    public static CustomYears of(Integer... years) {
      return new CustomYears(new TreeSet<>(Arrays.asList(years)));
    }

    @Override
    public List<Integer> activeYears() {
      return List.copyOf(years);
    }
  }
}
