package forensic.damages.core.schedule;

import java.util.List;

/**
 * All plan items incurred in one plan year.
 *
 * @param yearNumber 1-based plan year
 * @param calendarYear {@code baseCalendarYear + yearNumber - 1}
 * @param entries items incurred that year, in plan order
 * @param totalInflated sum of inflated costs
 * @param totalPv sum of present values
 * @param cumulativePv running total of {@code totalPv} through this year
 */
public record DetailedLcpRow(
    int yearNumber,
    int calendarYear,
    List<DetailedLcpEntry> entries,
    double totalInflated,
    double totalPv,
    double cumulativePv) {

  public DetailedLcpRow {
    entries = List.copyOf(entries);
  }
}
