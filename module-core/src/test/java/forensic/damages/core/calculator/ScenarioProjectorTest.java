package forensic.damages.core.calculator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import forensic.damages.core.domain.model.CaseInfo;
import forensic.damages.core.domain.model.DateCalc;
import forensic.damages.core.domain.model.EarningsCase;
import forensic.damages.core.domain.model.EarningsParams;
import forensic.damages.core.domain.model.HouseholdServices;
import forensic.damages.core.domain.model.HouseholdServicesValuation;
import forensic.damages.core.domain.model.LcpValuation;
import forensic.damages.core.domain.model.ManualActuals;
import forensic.damages.core.domain.model.Projection;
import forensic.damages.core.domain.model.ScenarioInput;
import forensic.damages.core.domain.model.ScenarioKind;
import forensic.damages.core.domain.model.ScenarioProjection;
import forensic.damages.core.domain.model.TaxCombinationMethod;
import forensic.damages.core.domain.model.YfsOrigin;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ScenarioProjector")
class ScenarioProjectorTest {

  private static final LocalDate TODAY = LocalDate.of(2025, 1, 1);
  private static final CaseInfo CASE =
      CaseInfo.of(LocalDate.of(1990, 1, 1), LocalDate.of(2020, 1, 1), LocalDate.of(2024, 1, 1), 67);

  private final DateCalculator dateCalculator = new DateCalculator(YfsOrigin.INJURY_DATE);
  private final AlgebraicFactorEngine factorEngine =
      new AlgebraicFactorEngine(TaxCombinationMethod.MULTIPLICATIVE);
  private final EarningsProjectionEngine projectionEngine = new EarningsProjectionEngine();
  private final ScenarioProjector projector =
      new ScenarioProjector(
          dateCalculator, factorEngine, projectionEngine, new GrandTotalAggregator());

  private static EarningsParams.Builder params() {
    return EarningsParams.builder().baseEarnings(65_000).residualEarnings(15_000).wle(20);
  }

  private EarningsCase earningsCase(CaseInfo caseInfo, EarningsParams params) {
    return new EarningsCase(
        caseInfo, params, dateCalculator.calculate(caseInfo, TODAY), ManualActuals.none(), false);
  }

  private ScenarioInput input(EarningsParams params) {
    return new ScenarioInput(
        earningsCase(CASE, params),
        new HouseholdServices(true, 10, 25, 3, 4.25),
        new HouseholdServicesValuation(300_000, 200_000),
        new LcpValuation(List.of(), 150_000, 100_000));
  }

  @Nested
  @DisplayName("scenario list")
  class ScenarioList {

    @Test
    @DisplayName("WLE, 65, 67, 70 in order")
    void order() {
      List<ScenarioProjection> scenarios = projector.project(input(params().build()));

      assertThat(scenarios)
          .extracting(ScenarioProjection::id)
          .containsExactly("wle", "age65", "age67", "age70");
      assertThat(scenarios)
          .extracting(ScenarioProjection::kind)
          .containsExactly(
              ScenarioKind.WLE, ScenarioKind.STANDARD_AGE, ScenarioKind.STANDARD_AGE, ScenarioKind.STANDARD_AGE);
      assertThat(scenarios.get(0).label()).isEqualTo("WLE (Age 50.0)");
      assertThat(scenarios.get(0).retirementAge()).isCloseTo(50.0, within(0.01));
      assertThat(scenarios).allMatch(ScenarioProjection::included);
    }

    @Test
    @DisplayName("PJI age is appended when configured")
    void pji() {
      List<ScenarioProjection> scenarios = projector.project(input(params().pjiAge(62.0).build()));

      ScenarioProjection last = scenarios.get(scenarios.size() - 1);
      assertThat(last.id()).isEqualTo("pji");
      assertThat(last.label()).isEqualTo("PJI (Age 62)");
      assertThat(last.kind()).isEqualTo(ScenarioKind.PJI);
    }

    @Test
    @DisplayName("no scenarios without a WLE")
    void noWle() {
      assertThat(projector.project(input(params().wle(0).build()))).isEmpty();
    }

    @Test
    @DisplayName("no scenarios without an injury date")
    void noInjuryDate() {
      CaseInfo noInjury = CaseInfo.of(LocalDate.of(1990, 1, 1), null, LocalDate.of(2024, 1, 1), 67);

      ScenarioInput scenarioInput =
          new ScenarioInput(earningsCase(noInjury, params().build()), null, null, null);

      assertThat(projector.project(scenarioInput)).isEmpty();
    }
  }

  @Nested
  @DisplayName("scenario figures")
  class Figures {

    @Test
    @DisplayName("the case retirement age reproduces the main projection")
    void matchesMainProjection() {
      EarningsParams params = params().build();
      EarningsCase earningsCase = earningsCase(CASE, params);
      DateCalc dates = earningsCase.dateCalc();
      Projection main =
          projectionEngine.project(
              CASE, params, factorEngine.calculate(params, dates, false), ManualActuals.none(), dates);

      ScenarioProjection age67 = projector.project(input(params)).get(2);

      assertThat(age67.totalPastLoss()).isEqualTo(main.totalPastLoss());
      assertThat(age67.totalFuturePv()).isEqualTo(main.totalFuturePV());
      assertThat(age67.yfs()).isEqualTo(dates.derivedYfs());
    }

    @Test
    @DisplayName("grand total adds household and life care plan present values")
    void grandTotal() {
      ScenarioProjection scenario = projector.project(input(params().build())).get(1);

      assertThat(scenario.grandTotal())
          .isCloseTo(scenario.totalEarningsLoss() + 200_000 + 100_000, within(1e-6));
    }

    @Test
    @DisplayName("later retirement means a longer horizon and a lower WLF")
    void laterRetirement() {
      List<ScenarioProjection> scenarios = projector.project(input(params().build()));

      assertThat(scenarios.get(3).yfs()).isGreaterThan(scenarios.get(1).yfs());
      assertThat(scenarios.get(3).wlf()).isLessThan(scenarios.get(1).wlf());
      assertThat(scenarios.get(1).wlfPercent()).isCloseTo(scenarios.get(1).wlf() * 100, within(1e-12));
    }

    @Test
    @DisplayName("past loss does not depend on the retirement age horizon length")
    void pastRowsCount() {
      EarningsCase earningsCase = earningsCase(CASE, params().build());

      assertThat(projector.projectAtRetirementAge(earningsCase, 65).pastSchedule())
          .hasSameSizeAs(projector.projectAtRetirementAge(earningsCase, 70).pastSchedule());
    }
  }
}
