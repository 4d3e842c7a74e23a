package forensic.damages.config;

import forensic.damages.core.domain.model.EngineSettings;
import forensic.damages.core.domain.model.TaxCombinationMethod;
import forensic.damages.core.domain.model.YfsOrigin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Calculation conventions that economists disagree on.
 *
 * <pre>
 * damages:
 *   engine:
 *     tax-combination: MULTIPLICATIVE   # or ADDITIVE
 *     yfs-origin: INJURY_DATE           # or TRIAL_DATE
 * </pre>
 *
 * @param taxCombination how federal and state rates combine
 * @param yfsOrigin date the Years to Final Separation horizon is measured from
 */
@Validated
@ConfigurationProperties(prefix = "damages.engine")
public record DamagesEngineProperties(
    @DefaultValue("MULTIPLICATIVE") @NotNull TaxCombinationMethod taxCombination,
    @DefaultValue("INJURY_DATE") @NotNull YfsOrigin yfsOrigin) {

  public EngineSettings toSettings() {
    return new EngineSettings(taxCombination, yfsOrigin);
  }
}
