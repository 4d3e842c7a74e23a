package forensic.damages.core.schedule;

import forensic.damages.core.calculator.HouseholdServicesValuator;
import forensic.damages.core.calculator.HouseholdServicesValuator.HouseholdCashFlow;
import forensic.damages.core.calculator.LifeCarePlanValuator;
import forensic.damages.core.calculator.ScenarioProjector;
import forensic.damages.core.domain.model.EarningsCase;
import forensic.damages.core.domain.model.FutureScheduleRow;
import forensic.damages.core.domain.model.HouseholdServices;
import forensic.damages.core.domain.model.LcpCashFlow;
import forensic.damages.core.domain.model.LcpItem;
import forensic.damages.core.domain.model.PastScheduleRow;
import forensic.damages.core.domain.model.Projection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Year-by-year tables behind the summary figures.
 *
 * <p>Every schedule is computed with the same engines as the totals, so the last row's cumulative
 * present value always equals the matching total.
 */
public class DetailedScheduleGenerator {

  private final ScenarioProjector scenarioProjector;
  private final LifeCarePlanValuator lcpValuator;
  private final HouseholdServicesValuator householdValuator;

  public DetailedScheduleGenerator(
      ScenarioProjector scenarioProjector,
      LifeCarePlanValuator lcpValuator,
      HouseholdServicesValuator householdValuator) {
    this.scenarioProjector = Objects.requireNonNull(scenarioProjector, "scenarioProjector");
    this.lcpValuator = Objects.requireNonNull(lcpValuator, "lcpValuator");
    this.householdValuator = Objects.requireNonNull(householdValuator, "householdValuator");
  }

  /**
   * Past and future earnings loss for one retirement age. Past rows keep their own calendar year;
   * future rows are numbered from {@code baseCalendarYear}.
   */
  public List<DetailedEarningsRow> earnings(
      EarningsCase earningsCase, double retirementAge, int baseCalendarYear) {
    Projection projection = scenarioProjector.projectAtRetirementAge(earningsCase, retirementAge);
    List<DetailedEarningsRow> rows = new ArrayList<>();
    double cumulative = 0;
    int pastNumber = 1;
    for (PastScheduleRow past : projection.pastSchedule()) {
      cumulative += past.netLoss();
      rows.add(
          new DetailedEarningsRow(
              pastNumber++,
              past.year(),
              past.grossBase(),
              past.netLoss(),
              past.netLoss(),
              cumulative,
              true));
    }
    for (FutureScheduleRow future : projection.futureSchedule()) {
      cumulative += future.pv();
      rows.add(
          new DetailedEarningsRow(
              future.year(),
              baseCalendarYear + future.year() - 1,
              future.gross(),
              future.netLoss(),
              future.pv(),
              cumulative,
              false));
    }
    return rows;
  }

  /** One row per plan year in which any item is incurred, ascending. */
  public List<DetailedLcpRow> lifeCarePlan(
      List<LcpItem> items, double discountRatePct, boolean presentValueEnabled, int baseCalendarYear) {
    Map<Integer, List<DetailedLcpEntry>> byYear = new TreeMap<>();
    if (items != null) {
      for (LcpItem item : items) {
        for (LcpCashFlow flow : lcpValuator.cashFlows(item, discountRatePct, presentValueEnabled)) {
          byYear
              .computeIfAbsent(flow.yearNumber(), year -> new ArrayList<>())
              .add(
                  new DetailedLcpEntry(
                      item.name(), item.baseCost(), flow.inflatedCost(), flow.presentValue()));
        }
      }
    }

    List<DetailedLcpRow> rows = new ArrayList<>(byYear.size());
    double cumulative = 0;
    for (Map.Entry<Integer, List<DetailedLcpEntry>> year : byYear.entrySet()) {
      double inflated = 0;
      double pv = 0;
      for (DetailedLcpEntry entry : year.getValue()) {
        inflated += entry.inflatedCost();
        pv += entry.presentValue();
      }
      cumulative += pv;
      int yearNumber = year.getKey();
      rows.add(
          new DetailedLcpRow(
              yearNumber,
              baseCalendarYear + yearNumber - 1,
              year.getValue(),
              inflated,
              pv,
              cumulative));
    }
    return rows;
  }

  /** One row per year of the horizon; empty when the claim is inactive. */
  public List<DetailedHouseholdRow> household(
      HouseholdServices services, double yfs, boolean presentValueEnabled, int baseCalendarYear) {
    List<DetailedHouseholdRow> rows = new ArrayList<>();
    double cumulative = 0;
    for (HouseholdCashFlow flow : householdValuator.cashFlows(services, yfs, presentValueEnabled)) {
      cumulative += flow.presentValue();
      rows.add(
          new DetailedHouseholdRow(
              flow.yearIndex() + 1,
              baseCalendarYear + flow.yearIndex(),
              flow.value(),
              flow.presentValue(),
              cumulative));
    }
    return rows;
  }
}
