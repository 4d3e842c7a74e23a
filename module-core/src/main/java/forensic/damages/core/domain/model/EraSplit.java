package forensic.damages.core.domain.model;

/**
 * Explicit wage-growth era boundary. Calendar years before {@code splitYear} belong to era 1, the
 * split year and later to era 2.
 */
public record EraSplit(int splitYear, double era1WageGrowthPct, double era2WageGrowthPct) {

  public int eraOf(int calendarYear) {
    return calendarYear < splitYear ? 1 : 2;
  }
}
