package forensic.damages.core.schedule;

/**
 * Past and future earnings rows in one shape, as carried by report snapshots.
 *
 * @param type period the row belongs to
 * @param label {@code Past-n} or {@code Future-n}
 * @param calendarYear calendar year the row covers
 * @param fraction share of the year counted (1 except for a final partial past year)
 * @param grossEarnings but-for gross earnings
 * @param netLoss net earnings loss
 * @param discountFactor 1 for past rows
 * @param presentValue {@code netLoss × discountFactor}
 * @param cumulativePv running total through this row
 * @param era growth era applied
 */
public record PeriodRow(
    PeriodType type,
    String label,
    int calendarYear,
    double fraction,
    double grossEarnings,
    double netLoss,
    double discountFactor,
    double presentValue,
    double cumulativePv,
    int era) {}
