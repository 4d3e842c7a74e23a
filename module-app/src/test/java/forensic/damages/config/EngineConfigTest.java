package forensic.damages.config;

import static org.assertj.core.api.Assertions.assertThat;

import forensic.damages.core.DamagesEngine;
import forensic.damages.core.domain.cpi.CpiCategoryTable;
import forensic.damages.core.domain.model.TaxCombinationMethod;
import forensic.damages.core.domain.model.YfsOrigin;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

@DisplayName("EngineConfig")
class EngineConfigTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(PropertiesConfig.class, EngineConfig.class);

  @Configuration
  @EnableConfigurationProperties({
    DamagesEngineProperties.class,
    CpiCategoryProperties.class,
    ReportProperties.class
  })
  static class PropertiesConfig {}

  @Nested
  @DisplayName("defaults")
  class Defaults {

    @Test
    @DisplayName("multiplicative taxes measured from the injury date")
    void engineDefaults() {
      contextRunner.run(
          context -> {
            assertThat(context).hasSingleBean(DamagesEngine.class);
            DamagesEngineProperties properties = context.getBean(DamagesEngineProperties.class);
            assertThat(properties.taxCombination()).isEqualTo(TaxCombinationMethod.MULTIPLICATIVE);
            assertThat(properties.yfsOrigin()).isEqualTo(YfsOrigin.INJURY_DATE);
          });
    }

    @Test
    @DisplayName("published CPI table when no categories are configured")
    void cpiDefaults() {
      contextRunner.run(
          context ->
              assertThat(context.getBean(CpiCategoryTable.class))
                  .isSameAs(CpiCategoryTable.defaults()));
    }

    @Test
    @DisplayName("report provenance")
    void reportDefaults() {
      contextRunner.run(
          context -> {
            ReportProperties report = context.getBean(ReportProperties.class);
            assertThat(report.appVersion()).isEqualTo("1.0.0");
            assertThat(report.schemaVersion()).isEqualTo("v10");
          });
    }
  }

  @Nested
  @DisplayName("overrides")
  class Overrides {

    @Test
    @DisplayName("conventions bind from relaxed property names")
    void conventions() {
      contextRunner
          .withPropertyValues(
              "damages.engine.tax-combination=ADDITIVE", "damages.engine.yfs-origin=TRIAL_DATE")
          .run(
              context -> {
                DamagesEngine engine = context.getBean(DamagesEngine.class);
                assertThat(engine.settings().taxCombination())
                    .isEqualTo(TaxCombinationMethod.ADDITIVE);
                assertThat(engine.settings().yfsOrigin()).isEqualTo(YfsOrigin.TRIAL_DATE);
              });
    }

    @Test
    @DisplayName("configured categories replace the published table")
    void customTable() {
      contextRunner
          .withPropertyValues(
              "damages.cpi.version=2024-custom",
              "damages.cpi.categories[0].id=rx",
              "damages.cpi.categories[0].label=Prescriptions",
              "damages.cpi.categories[0].rate=2.1")
          .run(
              context -> {
                CpiCategoryTable table = context.getBean(CpiCategoryTable.class);
                assertThat(table.version()).isEqualTo("2024-custom");
                assertThat(table.categories()).hasSize(1);
                assertThat(table.rateFor("rx")).hasValue(2.1);
                assertThat(table.contains("surgery")).isFalse();
              });
    }

    @Test
    @DisplayName("out-of-range CPI rate fails startup")
    void invalidRate() {
      contextRunner
          .withPropertyValues(
              "damages.cpi.categories[0].id=rx",
              "damages.cpi.categories[0].label=Prescriptions",
              "damages.cpi.categories[0].rate=99")
          .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("unknown convention fails startup")
    void invalidConvention() {
      contextRunner
          .withPropertyValues("damages.engine.tax-combination=COMPOUND")
          .run(context -> assertThat(context).hasFailed());
    }
  }
}
