package forensic.damages.core.schedule;

import forensic.damages.core.domain.model.FutureScheduleRow;
import forensic.damages.core.domain.model.PastScheduleRow;
import forensic.damages.core.domain.model.Projection;
import java.util.ArrayList;
import java.util.List;

/** Flattens a {@link Projection} into {@link PeriodRow}s, past first. */
public final class PeriodRows {

  private PeriodRows() {
    throw new UnsupportedOperationException("Utility class");
  }

  public static List<PeriodRow> from(Projection projection) {
    List<PeriodRow> rows =
        new ArrayList<>(projection.pastSchedule().size() + projection.futureSchedule().size());
    double cumulative = 0;
    for (PastScheduleRow past : projection.pastSchedule()) {
      cumulative += past.netLoss();
      rows.add(
          new PeriodRow(
              PeriodType.PAST,
              past.label(),
              past.year(),
              past.fraction(),
              past.grossBase(),
              past.netLoss(),
              1,
              past.netLoss(),
              cumulative,
              past.era()));
    }
    for (FutureScheduleRow future : projection.futureSchedule()) {
      cumulative += future.pv();
      rows.add(
          new PeriodRow(
              PeriodType.FUTURE,
              "Future-" + future.year(),
              future.calendarYear(),
              1,
              future.gross(),
              future.netLoss(),
              future.discountFactor(),
              future.pv(),
              cumulative,
              future.era()));
    }
    return rows;
  }
}
