package forensic.damages.core.domain.model;

import java.util.List;

/**
 * Valued plan item.
 *
 * @param item source item
 * @param cpiRatePct inflation rate actually applied
 * @param activeYears plan years in which the item is incurred
 * @param totalNominal sum of inflated costs
 * @param totalPresentValue sum of discounted inflated costs
 */
public record LcpItemValuation(
    LcpItem item,
    double cpiRatePct,
    List<Integer> activeYears,
    double totalNominal,
    double totalPresentValue) {

  public LcpItemValuation {
    activeYears = List.copyOf(activeYears);
  }
}
