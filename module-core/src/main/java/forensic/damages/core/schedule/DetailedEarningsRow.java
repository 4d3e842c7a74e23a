package forensic.damages.core.schedule;

/**
 * One year of the detailed earnings schedule.
 *
 * @param yearNumber 1-based position within its period
 * @param calendarYear calendar year the row covers
 * @param grossEarnings but-for gross earnings
 * @param netLoss net earnings loss for the year
 * @param presentValue discounted loss; equal to {@code netLoss} for past rows
 * @param cumulativePv running total of {@code presentValue} through this row
 * @param past true for injury-to-trial rows
 */
public record DetailedEarningsRow(
    int yearNumber,
    int calendarYear,
    double grossEarnings,
    double netLoss,
    double presentValue,
    double cumulativePv,
    boolean past) {}
