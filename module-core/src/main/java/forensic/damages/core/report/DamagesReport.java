package forensic.damages.core.report;

import forensic.damages.core.DamagesInput;
import forensic.damages.core.DamagesResult;
import forensic.damages.core.domain.model.AlgebraicFactors;
import forensic.damages.core.domain.model.DateCalc;
import forensic.damages.core.domain.model.HouseholdServicesValuation;
import forensic.damages.core.domain.model.LcpValuation;
import forensic.damages.core.domain.model.Projection;
import forensic.damages.core.domain.model.ScenarioProjection;
import forensic.damages.core.schedule.PeriodRow;
import java.time.Instant;
import java.util.List;

/**
 * Self-contained snapshot of one calculation, the payload export collaborators render from.
 *
 * @param metadata provenance
 * @param assumptions inputs exactly as submitted
 * @param calculations intermediate results
 * @param results scenarios and totals
 * @param periods unified past and future rows
 */
public record DamagesReport(
    ReportMetadata metadata,
    DamagesInput assumptions,
    Calculations calculations,
    Results results,
    List<PeriodRow> periods) {

  public DamagesReport {
    periods = List.copyOf(periods);
  }

  public record Calculations(
      DateCalc dateCalc,
      AlgebraicFactors factors,
      Projection projection,
      HouseholdServicesValuation householdValuation,
      LcpValuation lcpValuation,
      double workLifeFactorPct) {}

  public record Results(
      List<ScenarioProjection> scenarios, double grandTotal, SummaryMetrics summaryMetrics) {

    public Results {
      scenarios = List.copyOf(scenarios);
    }
  }

  public static DamagesReport of(
      DamagesInput input,
      DamagesResult result,
      String reportId,
      Instant generatedAt,
      String appVersion,
      String schemaVersion) {
    ReportMetadata metadata =
        new ReportMetadata(
            reportId,
            generatedAt,
            appVersion,
            schemaVersion,
            ReportMetadata.TINARI_ALGEBRAIC,
            input.selectedScenario(),
            result.includedScenarioIds());
    Calculations calculations =
        new Calculations(
            result.dateCalc(),
            result.factors(),
            result.projection(),
            result.householdValuation(),
            result.lcpValuation(),
            result.workLifeFactorPct());
    Results results =
        new Results(result.scenarios(), result.grandTotal(), result.summaryMetrics());
    return new DamagesReport(metadata, input, calculations, results, result.periods());
  }
}
