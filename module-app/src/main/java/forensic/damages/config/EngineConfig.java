package forensic.damages.config;

import forensic.damages.core.DamagesEngine;
import forensic.damages.core.domain.cpi.CpiCategoryTable;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the framework-free engine from bound properties. */
@Slf4j
@Configuration
public class EngineConfig {

  @Bean
  public CpiCategoryTable cpiCategoryTable(CpiCategoryProperties properties) {
    CpiCategoryTable table = properties.toTable();
    log.info(
        "[EngineConfig] CPI table loaded. version={}, categories={}",
        table.version(),
        table.categories().size());
    return table;
  }

  @Bean
  public DamagesEngine damagesEngine(
      DamagesEngineProperties properties, CpiCategoryTable cpiCategoryTable) {
    log.info(
        "[EngineConfig] Damages engine configured. taxCombination={}, yfsOrigin={}",
        properties.taxCombination(),
        properties.yfsOrigin());
    return new DamagesEngine(properties.toSettings(), cpiCategoryTable);
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
