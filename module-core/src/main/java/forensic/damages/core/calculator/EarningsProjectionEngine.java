package forensic.damages.core.calculator;

import forensic.damages.core.domain.model.AlgebraicFactors;
import forensic.damages.core.domain.model.CaseInfo;
import forensic.damages.core.domain.model.DateCalc;
import forensic.damages.core.domain.model.EarningsParams;
import forensic.damages.core.domain.model.EraSplit;
import forensic.damages.core.domain.model.FutureScheduleRow;
import forensic.damages.core.domain.model.ManualActuals;
import forensic.damages.core.domain.model.PastScheduleRow;
import forensic.damages.core.domain.model.Projection;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Year-by-year earnings loss.
 *
 * <h3>Past (injury → trial, undiscounted)</h3>
 *
 * <p>One row per elapsed year; the last row carries the fractional remainder of {@code pastYears}
 * and a zero remainder produces no row.
 *
 * <pre>
 * but-for = base × growth(i) × fraction × AIF
 * actual  = manual × realized multiplier          (manual entry for the year)
 *         | residual × growth(i) × fraction × AIF (otherwise)
 * </pre>
 *
 * <h3>Future (trial → separation, discounted)</h3>
 *
 * <p>{@code ceil(YFS)} rows starting in the trial year; growth restarts from base earnings.
 *
 * <pre>
 * netLoss = (base − residual) × growth(i) × AIF
 * pv      = netLoss × (1 + r)^-(i + 0.5)
 * </pre>
 *
 * <h3>Eras</h3>
 *
 * <p>Without an explicit {@link EraSplit}, past rows use era 1 and future rows era 2 with the single
 * wage-growth rate. With one, each row's calendar year picks its era's AIF and growth compounds
 * year by year at the rate of the era each step lands in.
 */
public class EarningsProjectionEngine {

  /**
   * @param caseInfo case dates (injury date required, trial date optional)
   * @param params earnings assumptions
   * @param factors factor breakdown for the same YFS
   * @param actuals manually entered actual past earnings
   * @param dateCalc derived spans
   * @return {@link Projection#EMPTY} when the injury date is missing
   */
  public Projection project(
      CaseInfo caseInfo,
      EarningsParams params,
      AlgebraicFactors factors,
      ManualActuals actuals,
      DateCalc dateCalc) {
    if (caseInfo == null || caseInfo.dateOfInjury() == null) {
      return Projection.EMPTY;
    }

    int startYear = caseInfo.dateOfInjury().getYear();
    int fullPast = (int) Math.floor(dateCalc.pastYears());
    double partialPast = dateCalc.pastYears() % 1;
    int trialYear =
        caseInfo.dateOfTrial() != null ? caseInfo.dateOfTrial().getYear() : startYear + fullPast;

    List<PastScheduleRow> past = new ArrayList<>();
    for (int i = 0; i <= fullPast; i++) {
      double fraction = i < fullPast ? 1 : partialPast;
      if (fraction <= 0) {
        continue;
      }
      past.add(pastRow(params, factors, actuals, startYear, i, fraction));
    }

    List<FutureScheduleRow> future = new ArrayList<>();
    int futureYears = (int) Math.ceil(factors.yfs());
    for (int i = 0; i < futureYears; i++) {
      future.add(futureRow(params, factors, trialYear, i));
    }

    return Projection.of(past, future);
  }

  private PastScheduleRow pastRow(
      EarningsParams params,
      AlgebraicFactors factors,
      ManualActuals actuals,
      int startYear,
      int i,
      double fraction) {
    int calendarYear = startYear + i;
    int era = params.hasEraSplit() ? params.eraSplit().eraOf(calendarYear) : 1;
    double growth = growth(params, startYear, i, 1);
    double aif = factors.aif(era);

    double grossBase = params.baseEarnings() * growth * fraction;
    double netButFor = grossBase * aif;

    OptionalDouble manual = actuals.amountFor(calendarYear);
    double grossActual;
    double netActual;
    if (manual.isPresent()) {
      grossActual = manual.getAsDouble();
      netActual = grossActual * factors.realizedMultiplier();
    } else {
      grossActual = params.residualEarnings() * growth * fraction;
      netActual = grossActual * aif;
    }

    return new PastScheduleRow(
        calendarYear,
        "Past-" + (i + 1),
        grossBase,
        grossActual,
        netButFor - netActual,
        manual.isPresent(),
        fraction,
        era);
  }

  private FutureScheduleRow futureRow(
      EarningsParams params, AlgebraicFactors factors, int trialYear, int i) {
    int calendarYear = trialYear + i;
    int era = params.hasEraSplit() ? params.eraSplit().eraOf(calendarYear) : 2;
    double growth = growth(params, trialYear, i, 2);
    double aif = factors.aif(era);
    double discount =
        Discounting.midYearFactor(params.discountRatePct(), i, params.presentValueEnabled());

    double grossBase = params.baseEarnings() * growth;
    double grossResidual = params.residualEarnings() * growth;
    double netLoss = grossBase * aif - grossResidual * aif;

    return new FutureScheduleRow(
        i + 1, calendarYear, grossBase, netLoss, discount, netLoss * discount, era);
  }

  /**
   * Growth over {@code steps} years from {@code firstCalendarYear}. Without an explicit split the
   * single wage-growth rate applies ({@code defaultEra} only matters for the split case).
   */
  private double growth(EarningsParams params, int firstCalendarYear, int steps, int defaultEra) {
    if (!params.hasEraSplit()) {
      return Discounting.growthFactor(params.wageGrowthPct(), steps);
    }
    EraSplit split = params.eraSplit();
    int era1Steps = 0;
    for (int k = 1; k <= steps; k++) {
      if (split.eraOf(firstCalendarYear + k) == 1) {
        era1Steps++;
      }
    }
    return Discounting.growthFactor(split.era1WageGrowthPct(), era1Steps)
        * Discounting.growthFactor(split.era2WageGrowthPct(), steps - era1Steps);
  }
}
