package forensic.damages.core;

import forensic.damages.core.calculator.AlgebraicFactorEngine;
import forensic.damages.core.calculator.DateCalculator;
import forensic.damages.core.calculator.EarningsProjectionEngine;
import forensic.damages.core.calculator.GrandTotalAggregator;
import forensic.damages.core.calculator.HouseholdServicesValuator;
import forensic.damages.core.calculator.LifeCarePlanValuator;
import forensic.damages.core.calculator.ScenarioProjector;
import forensic.damages.core.domain.cpi.CpiCategoryTable;
import forensic.damages.core.domain.model.AlgebraicFactors;
import forensic.damages.core.domain.model.DateCalc;
import forensic.damages.core.domain.model.EarningsCase;
import forensic.damages.core.domain.model.EarningsParams;
import forensic.damages.core.domain.model.EngineSettings;
import forensic.damages.core.domain.model.HouseholdServicesValuation;
import forensic.damages.core.domain.model.LcpValuation;
import forensic.damages.core.domain.model.Projection;
import forensic.damages.core.domain.model.ScenarioInput;
import forensic.damages.core.domain.model.ScenarioProjection;
import forensic.damages.core.report.SummaryMetrics;
import forensic.damages.core.schedule.DetailedScheduleGenerator;
import forensic.damages.core.schedule.PeriodRows;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Full damages pipeline: dates, factors, earnings projection, household services, life care plan,
 * scenarios and grand total.
 *
 * <p>Stateless once built; one instance can serve concurrent calculations.
 */
public class DamagesEngine {

  private final EngineSettings settings;
  private final DateCalculator dateCalculator;
  private final AlgebraicFactorEngine factorEngine;
  private final EarningsProjectionEngine projectionEngine;
  private final HouseholdServicesValuator householdValuator;
  private final LifeCarePlanValuator lcpValuator;
  private final GrandTotalAggregator aggregator;
  private final ScenarioProjector scenarioProjector;
  private final DetailedScheduleGenerator scheduleGenerator;

  public DamagesEngine(EngineSettings settings, CpiCategoryTable cpiTable) {
    this.settings = settings;
    this.dateCalculator = new DateCalculator(settings.yfsOrigin());
    this.factorEngine = new AlgebraicFactorEngine(settings.taxCombination());
    this.projectionEngine = new EarningsProjectionEngine();
    this.householdValuator = new HouseholdServicesValuator();
    this.lcpValuator = new LifeCarePlanValuator(cpiTable);
    this.aggregator = new GrandTotalAggregator();
    this.scenarioProjector =
        new ScenarioProjector(dateCalculator, factorEngine, projectionEngine, aggregator);
    this.scheduleGenerator =
        new DetailedScheduleGenerator(scenarioProjector, lcpValuator, householdValuator);
  }

  public DamagesResult calculate(DamagesInput input, LocalDate today) {
    EarningsParams params = input.earningsParams();
    DateCalc dateCalc = dateCalculator.calculate(input.caseInfo(), today);
    AlgebraicFactors factors = factorEngine.calculate(params, dateCalc, input.unionMode());
    Projection projection =
        projectionEngine.project(input.caseInfo(), params, factors, input.actuals(), dateCalc);

    HouseholdServicesValuation household =
        householdValuator.value(
            input.householdServices(), dateCalc.derivedYfs(), params.presentValueEnabled());
    LcpValuation lcp =
        lcpValuator.value(input.lcpItems(), params.discountRatePct(), params.presentValueEnabled());

    double grandTotal =
        aggregator.aggregate(projection, input.householdServices(), household, lcp);

    ScenarioInput scenarioInput =
        new ScenarioInput(
            earningsCase(input, dateCalc), input.householdServices(), household, lcp);
    List<ScenarioProjection> scenarios = new ArrayList<>();
    for (ScenarioProjection scenario : scenarioProjector.project(scenarioInput)) {
      scenarios.add(scenario.withIncluded(!input.excludedScenarios().contains(scenario.id())));
    }

    return new DamagesResult(
        dateCalc,
        factors,
        factorEngine.workLifeFactorPercent(params, dateCalc.derivedYfs()),
        projection,
        household,
        lcp,
        scenarios,
        grandTotal,
        SummaryMetrics.of(projection, input.householdServices(), household, lcp, grandTotal),
        PeriodRows.from(projection));
  }

  public EarningsCase earningsCase(DamagesInput input, LocalDate today) {
    return earningsCase(input, dateCalculator.calculate(input.caseInfo(), today));
  }

  private EarningsCase earningsCase(DamagesInput input, DateCalc dateCalc) {
    return new EarningsCase(
        input.caseInfo(), input.earningsParams(), dateCalc, input.actuals(), input.unionMode());
  }

  public EngineSettings settings() {
    return settings;
  }

  public DetailedScheduleGenerator schedules() {
    return scheduleGenerator;
  }

  public LifeCarePlanValuator lifeCarePlanValuator() {
    return lcpValuator;
  }
}
