package forensic.damages.core;

import forensic.damages.core.domain.model.AlgebraicFactors;
import forensic.damages.core.domain.model.DateCalc;
import forensic.damages.core.domain.model.HouseholdServicesValuation;
import forensic.damages.core.domain.model.LcpValuation;
import forensic.damages.core.domain.model.Projection;
import forensic.damages.core.domain.model.ScenarioProjection;
import forensic.damages.core.report.SummaryMetrics;
import forensic.damages.core.schedule.PeriodRow;
import java.util.List;
import java.util.Optional;

/** Everything computed for one {@link DamagesInput}. */
public record DamagesResult(
    DateCalc dateCalc,
    AlgebraicFactors factors,
    double workLifeFactorPct,
    Projection projection,
    HouseholdServicesValuation householdValuation,
    LcpValuation lcpValuation,
    List<ScenarioProjection> scenarios,
    double grandTotal,
    SummaryMetrics summaryMetrics,
    List<PeriodRow> periods) {

  public DamagesResult {
    scenarios = List.copyOf(scenarios);
    periods = List.copyOf(periods);
  }

  public Optional<ScenarioProjection> scenario(String id) {
    return scenarios.stream().filter(s -> s.id().equals(id)).findFirst();
  }

  public List<String> includedScenarioIds() {
    return scenarios.stream().filter(ScenarioProjection::included).map(ScenarioProjection::id).toList();
  }
}
