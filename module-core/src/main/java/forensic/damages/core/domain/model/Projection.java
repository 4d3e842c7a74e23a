package forensic.damages.core.domain.model;

import java.util.List;

/**
 * Past and future earnings-loss schedules with their totals.
 *
 * <p>Totals are always the in-order sums of the rows; use {@link #of(List, List)} to build one.
 */
public record Projection(
    List<PastScheduleRow> pastSchedule,
    List<FutureScheduleRow> futureSchedule,
    double totalPastLoss,
    double totalFutureNominal,
    double totalFuturePV) {

  public static final Projection EMPTY = new Projection(List.of(), List.of(), 0, 0, 0);

  public Projection {
    pastSchedule = List.copyOf(pastSchedule);
    futureSchedule = List.copyOf(futureSchedule);
  }

  public static Projection of(List<PastScheduleRow> past, List<FutureScheduleRow> future) {
    double pastLoss = 0;
    for (PastScheduleRow row : past) {
      pastLoss += row.netLoss();
    }
    double futureNominal = 0;
    double futurePv = 0;
    for (FutureScheduleRow row : future) {
      futureNominal += row.netLoss();
      futurePv += row.pv();
    }
    return new Projection(past, future, pastLoss, futureNominal, futurePv);
  }

  public double totalEarningsLoss() {
    return totalPastLoss + totalFuturePV;
  }
}
