package forensic.damages.core.domain.model;

/**
 * One projected year after trial.
 *
 * @param year 1-based year index
 * @param calendarYear calendar year of the row
 * @param gross but-for gross earnings
 * @param netLoss net but-for minus net residual
 * @param discountFactor mid-year factor applied (1.0 when present value is disabled)
 * @param pv present value of {@code netLoss}
 * @param era growth/AIF era applied
 */
public record FutureScheduleRow(
    int year,
    int calendarYear,
    double gross,
    double netLoss,
    double discountFactor,
    double pv,
    int era) {}
