package forensic.damages.core.schedule;

/** One item's cost within a plan year. */
public record DetailedLcpEntry(
    String name, double baseCost, double inflatedCost, double presentValue) {}
