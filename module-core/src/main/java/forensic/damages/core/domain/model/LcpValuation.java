package forensic.damages.core.domain.model;

import java.util.List;

public record LcpValuation(
    List<LcpItemValuation> items, double totalNominal, double totalPresentValue) {

  public static final LcpValuation EMPTY = new LcpValuation(List.of(), 0, 0);

  public LcpValuation {
    items = List.copyOf(items);
  }
}
