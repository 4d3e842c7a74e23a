package forensic.damages.core.domain.model;

import java.util.Objects;

/**
 * Method choices the engine does not infer from case data.
 *
 * @param taxCombination federal/state combination rule
 * @param yfsOrigin where YFS is measured from
 */
public record EngineSettings(TaxCombinationMethod taxCombination, YfsOrigin yfsOrigin) {

  public EngineSettings {
    Objects.requireNonNull(taxCombination, "taxCombination");
    Objects.requireNonNull(yfsOrigin, "yfsOrigin");
  }

  public static EngineSettings defaults() {
    return new EngineSettings(TaxCombinationMethod.MULTIPLICATIVE, YfsOrigin.INJURY_DATE);
  }
}
