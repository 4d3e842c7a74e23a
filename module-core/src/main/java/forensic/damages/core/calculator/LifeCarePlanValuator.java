package forensic.damages.core.calculator;

import forensic.damages.core.domain.cpi.CpiCategoryTable;
import forensic.damages.core.domain.model.LcpCashFlow;
import forensic.damages.core.domain.model.LcpItem;
import forensic.damages.core.domain.model.LcpItemValuation;
import forensic.damages.core.domain.model.LcpValuation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Values life-care-plan items.
 *
 * <p>Inflation and discounting both run from the absolute plan-year index {@code t = year - 1}, so
 * an item starting in year 5 is already inflated four years when first incurred.
 *
 * <pre>
 * cost(t) = baseCost × (1 + cpi)^t
 * pv(t)   = cost(t) × (1 + r)^-(t + 0.5)
 * </pre>
 *
 * <p>The CPI rate is the item's override when set, else the table rate for its category, else 0.
 */
public class LifeCarePlanValuator {

  private final CpiCategoryTable cpiTable;

  public LifeCarePlanValuator(CpiCategoryTable cpiTable) {
    this.cpiTable = Objects.requireNonNull(cpiTable, "cpiTable");
  }

  public LcpValuation value(List<LcpItem> items, double discountRatePct, boolean presentValueEnabled) {
    if (items == null || items.isEmpty()) {
      return LcpValuation.EMPTY;
    }
    List<LcpItemValuation> valuations = new ArrayList<>(items.size());
    double nominal = 0;
    double pv = 0;
    for (LcpItem item : items) {
      LcpItemValuation valuation = valueItem(item, discountRatePct, presentValueEnabled);
      valuations.add(valuation);
      nominal += valuation.totalNominal();
      pv += valuation.totalPresentValue();
    }
    return new LcpValuation(valuations, nominal, pv);
  }

  public LcpItemValuation valueItem(LcpItem item, double discountRatePct, boolean presentValueEnabled) {
    double nominal = 0;
    double pv = 0;
    for (LcpCashFlow flow : cashFlows(item, discountRatePct, presentValueEnabled)) {
      nominal += flow.inflatedCost();
      pv += flow.presentValue();
    }
    return new LcpItemValuation(
        item, resolveCpiRate(item), item.frequency().activeYears(), nominal, pv);
  }

  /** One flow per active year, ascending. */
  public List<LcpCashFlow> cashFlows(
      LcpItem item, double discountRatePct, boolean presentValueEnabled) {
    double cpiRate = resolveCpiRate(item);
    List<Integer> years = item.frequency().activeYears();
    List<LcpCashFlow> flows = new ArrayList<>(years.size());
    for (int year : years) {
      int t = year - 1;
      double cost = item.baseCost() * Discounting.growthFactor(cpiRate, t);
      double discount = Discounting.midYearFactor(discountRatePct, t, presentValueEnabled);
      flows.add(new LcpCashFlow(year, cost, cost * discount));
    }
    return flows;
  }

  public double resolveCpiRate(LcpItem item) {
    if (item.cpiOverridePct() != null) {
      return item.cpiOverridePct();
    }
    return cpiTable.rateFor(item.categoryId()).orElse(0);
  }
}
