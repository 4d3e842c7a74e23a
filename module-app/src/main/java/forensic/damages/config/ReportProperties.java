package forensic.damages.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Provenance stamped on report snapshots.
 *
 * @param appVersion producing service version
 * @param schemaVersion snapshot layout version
 */
@Validated
@ConfigurationProperties(prefix = "damages.report")
public record ReportProperties(
    @DefaultValue("1.0.0") @NotBlank String appVersion,
    @DefaultValue("v10") @NotBlank String schemaVersion) {}
