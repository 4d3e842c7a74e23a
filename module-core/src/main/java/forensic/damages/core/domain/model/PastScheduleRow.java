package forensic.damages.core.domain.model;

/**
 * One elapsed (injury → trial) year.
 *
 * @param year calendar year
 * @param label display label, {@code Past-1}, {@code Past-2}, …
 * @param grossBase but-for gross earnings for the (partial) year
 * @param grossActual actual gross earnings, manual or residual
 * @param netLoss net but-for minus net actual
 * @param manual whether {@code grossActual} came from a manual entry
 * @param fraction portion of the year counted (1.0 except possibly the last row)
 * @param era growth/AIF era applied
 */
public record PastScheduleRow(
    int year,
    String label,
    double grossBase,
    double grossActual,
    double netLoss,
    boolean manual,
    double fraction,
    int era) {}
