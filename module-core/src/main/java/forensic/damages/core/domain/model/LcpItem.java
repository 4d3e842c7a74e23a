package forensic.damages.core.domain.model;

import java.util.Objects;

/**
 * One life-care-plan line.
 *
 * @param id item id assigned upstream
 * @param name description, e.g. "Physical therapy"
 * @param categoryId CPI category driving the inflation rate
 * @param baseCost cost per occurrence in today's dollars
 * @param cpiOverridePct explicit inflation rate in percent; nullable, wins over the category rate
 * @param frequency occurrence pattern
 */
public record LcpItem(
    long id,
    String name,
    String categoryId,
    double baseCost,
    Double cpiOverridePct,
    LcpFrequency frequency) {

  public LcpItem {
    Objects.requireNonNull(frequency, "frequency");
  }
}
