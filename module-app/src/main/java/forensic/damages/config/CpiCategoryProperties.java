package forensic.damages.config;

import forensic.damages.core.domain.cpi.CpiCategory;
import forensic.damages.core.domain.cpi.CpiCategoryTable;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * CPI category table override. With no categories configured the engine's published table is
 * used.
 *
 * @param version table version reported alongside the rates
 * @param categories category rates in display order
 */
@Validated
@ConfigurationProperties(prefix = "damages.cpi")
public record CpiCategoryProperties(
    @DefaultValue("2021-bls") @NotBlank String version, @Valid List<Category> categories) {

  public record Category(
      @NotBlank String id,
      @NotBlank String label,
      @DecimalMin("-5.0") @DecimalMax("25.0") double rate) {}

  public CpiCategoryTable toTable() {
    if (categories == null || categories.isEmpty()) {
      return CpiCategoryTable.defaults();
    }
    return new CpiCategoryTable(
        version,
        categories.stream().map(c -> new CpiCategory(c.id(), c.label(), c.rate())).toList());
  }
}
