package forensic.damages.core.calculator;

import forensic.damages.core.domain.model.AlgebraicFactors;
import forensic.damages.core.domain.model.DateCalc;
import forensic.damages.core.domain.model.EarningsCase;
import forensic.damages.core.domain.model.EarningsParams;
import forensic.damages.core.domain.model.Projection;
import forensic.damages.core.domain.model.ScenarioInput;
import forensic.damages.core.domain.model.ScenarioKind;
import forensic.damages.core.domain.model.ScenarioProjection;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Recomputes the full damages under alternative retirement ages: the WLE-implied age, the standard
 * ages 65, 67 and 70, and the PJI age when one is configured (in that order).
 *
 * <p>Every scenario goes through the same factor and projection engines as the main calculation,
 * so a scenario whose age equals the case retirement age reproduces the main figures exactly.
 */
public class ScenarioProjector {

  public static final String WLE_ID = "wle";
  public static final String PJI_ID = "pji";

  private static final int[] STANDARD_AGES = {65, 67, 70};

  private final DateCalculator dateCalculator;
  private final AlgebraicFactorEngine factorEngine;
  private final EarningsProjectionEngine projectionEngine;
  private final GrandTotalAggregator aggregator;

  public ScenarioProjector(
      DateCalculator dateCalculator,
      AlgebraicFactorEngine factorEngine,
      EarningsProjectionEngine projectionEngine,
      GrandTotalAggregator aggregator) {
    this.dateCalculator = Objects.requireNonNull(dateCalculator, "dateCalculator");
    this.factorEngine = Objects.requireNonNull(factorEngine, "factorEngine");
    this.projectionEngine = Objects.requireNonNull(projectionEngine, "projectionEngine");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
  }

  /**
   * @return scenarios in display order, all included; empty when the birth or injury date is
   *     missing, the age at injury is not positive, or the WLE is zero
   */
  public List<ScenarioProjection> project(ScenarioInput input) {
    EarningsCase earningsCase = input.earningsCase();
    EarningsParams params = earningsCase.params();
    double ageAtInjury = dateCalculator.ageAtInjury(earningsCase.caseInfo());
    if (ageAtInjury <= 0 || params.wle() == 0) {
      return List.of();
    }

    List<ScenarioProjection> scenarios = new ArrayList<>();
    double wleAge = ageAtInjury + params.wle();
    if (wleAge > 0) {
      scenarios.add(
          scenario(
              input,
              WLE_ID,
              String.format(Locale.US, "WLE (Age %.1f)", wleAge),
              ScenarioKind.WLE,
              wleAge));
    }
    for (int age : STANDARD_AGES) {
      scenarios.add(
          scenario(input, "age" + age, "Age " + age, ScenarioKind.STANDARD_AGE, age));
    }
    if (params.hasPji()) {
      double pjiAge = params.pjiAge();
      scenarios.add(
          scenario(input, PJI_ID, "PJI (Age " + plain(pjiAge) + ")", ScenarioKind.PJI, pjiAge));
    }
    return scenarios;
  }

  /** Past and future earnings loss assuming retirement at {@code retirementAge}. */
  public Projection projectAtRetirementAge(EarningsCase earningsCase, double retirementAge) {
    DateCalc dateCalc = scenarioDates(earningsCase, retirementAge);
    AlgebraicFactors factors =
        factorEngine.calculate(earningsCase.params(), dateCalc, earningsCase.unionMode());
    return projectionEngine.project(
        earningsCase.caseInfo(), earningsCase.params(), factors, earningsCase.actuals(), dateCalc);
  }

  /** Case spans with the separation horizon moved to {@code retirementAge}. */
  public DateCalc scenarioDates(EarningsCase earningsCase, double retirementAge) {
    DateCalc base = earningsCase.dateCalc();
    double originAge =
        DateCalc.EMPTY.equals(base)
            ? dateCalculator.ageAtInjury(earningsCase.caseInfo())
            : dateCalculator.originAge(base);
    return base.withDerivedYfs(Math.max(0, retirementAge - originAge));
  }

  private ScenarioProjection scenario(
      ScenarioInput input, String id, String label, ScenarioKind kind, double retirementAge) {
    EarningsCase earningsCase = input.earningsCase();
    DateCalc dateCalc = scenarioDates(earningsCase, retirementAge);
    AlgebraicFactors factors =
        factorEngine.calculate(earningsCase.params(), dateCalc, earningsCase.unionMode());
    Projection projection =
        projectionEngine.project(
            earningsCase.caseInfo(),
            earningsCase.params(),
            factors,
            earningsCase.actuals(),
            dateCalc);
    double grandTotal =
        aggregator.aggregate(
            projection,
            input.householdServices(),
            input.householdValuation(),
            input.lcpValuation());
    return new ScenarioProjection(
        id,
        label,
        kind,
        retirementAge,
        factors.yfs(),
        factors.wlf(),
        projection.totalPastLoss(),
        projection.totalFuturePV(),
        projection.totalEarningsLoss(),
        grandTotal,
        true);
  }

  private static String plain(double age) {
    return BigDecimal.valueOf(age).stripTrailingZeros().toPlainString();
  }
}
