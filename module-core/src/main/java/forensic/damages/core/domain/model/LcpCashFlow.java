package forensic.damages.core.domain.model;

/**
 * Cost of one plan item in one active year.
 *
 * @param yearNumber 1-based plan year
 * @param inflatedCost base cost grown by the item's CPI rate
 * @param presentValue {@code inflatedCost} discounted at the mid-year convention
 */
public record LcpCashFlow(int yearNumber, double inflatedCost, double presentValue) {}
