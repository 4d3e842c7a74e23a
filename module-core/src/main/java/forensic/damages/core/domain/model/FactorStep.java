package forensic.damages.core.domain.model;

/**
 * One line of the Tinari factor table.
 *
 * @param label step name
 * @param fraction cumulative value as a fraction of gross earnings
 * @param amount {@code fraction} applied to a concrete gross earnings figure
 */
public record FactorStep(String label, double fraction, double amount) {}
