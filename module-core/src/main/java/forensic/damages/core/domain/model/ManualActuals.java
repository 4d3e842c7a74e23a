package forensic.damages.core.domain.model;

import forensic.damages.core.parse.AmountParser;
import java.util.Collections;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Sparse {@code calendar year → entered amount} map of actual post-injury earnings.
 *
 * <p>Values stay as entered; {@link #amountFor(int)} is empty for blank or unparseable entries, in
 * which case the projection falls back to residual earnings for that year.
 */
public final class ManualActuals {

  private static final ManualActuals NONE = new ManualActuals(Map.of());

  private final Map<Integer, String> entries;

  private ManualActuals(Map<Integer, String> entries) {
    this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
  }

  public static ManualActuals of(Map<Integer, String> entries) {
    return entries == null || entries.isEmpty() ? NONE : new ManualActuals(entries);
  }

  public static ManualActuals none() {
    return NONE;
  }

  public OptionalDouble amountFor(int calendarYear) {
    return AmountParser.parse(entries.get(calendarYear));
  }

  public Map<Integer, String> entries() {
    return entries;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ManualActuals other && entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return "ManualActuals" + entries;
  }
}
