package forensic.damages.service;

import forensic.damages.config.ReportProperties;
import forensic.damages.controller.dto.DamagesRequest;
import forensic.damages.core.DamagesEngine;
import forensic.damages.core.DamagesInput;
import forensic.damages.core.DamagesResult;
import forensic.damages.core.domain.cpi.CpiCategory;
import forensic.damages.core.domain.cpi.CpiCategoryTable;
import forensic.damages.core.domain.model.EarningsParams;
import forensic.damages.core.domain.model.ScenarioProjection;
import forensic.damages.core.format.DamagesFormatter;
import forensic.damages.core.report.DamagesReport;
import forensic.damages.core.schedule.DetailedEarningsRow;
import forensic.damages.core.schedule.DetailedHouseholdRow;
import forensic.damages.core.schedule.DetailedLcpRow;
import forensic.damages.error.exception.DamagesCalculationException;
import forensic.damages.error.exception.ScenarioNotFoundException;
import forensic.damages.error.exception.UnknownCpiCategoryException;
import forensic.damages.error.exception.base.BaseException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the damages engine for HTTP callers.
 *
 * <ul>
 *   <li>Maps the entry form into engine input (dates relative to the injected {@link Clock})
 *   <li>Times every run under {@code damages.calculation}, tagged by operation
 *   <li>Turns unexpected engine failures into {@link DamagesCalculationException}
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DamagesCalculationService {

  static final String TIMER_NAME = "damages.calculation";
  static final String FAILURE_COUNTER_NAME = "damages.calculation.failures";
  static final String DEFAULT_SCENARIO = "wle";

  private final DamagesEngine engine;
  private final CpiCategoryTable cpiTable;
  private final DamagesRequestMapper mapper;
  private final ReportProperties reportProperties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /** Full pipeline, packaged as a report snapshot. */
  public DamagesReport calculate(DamagesRequest request) {
    LocalDate today = LocalDate.now(clock);
    DamagesInput input = mapper.toInput(request, null, today);
    DamagesResult result =
        timed("calculate", caseRef(input), () -> engine.calculate(input, today));

    log.info(
        "[Damages] Calculation completed. fileNumber={}, scenarios={}, grandTotal={}",
        caseRef(input),
        result.scenarios().size(),
        DamagesFormatter.usd(result.grandTotal()));

    return DamagesReport.of(
        input,
        result,
        UUID.randomUUID().toString(),
        clock.instant(),
        reportProperties.appVersion(),
        reportProperties.schemaVersion());
  }

  /**
   * Year-by-year earnings loss under one scenario's retirement age.
   *
   * @param scenarioId scenario id, {@code wle} when null
   * @throws ScenarioNotFoundException when the case yields no such scenario
   */
  public List<DetailedEarningsRow> earningsSchedule(
      DamagesRequest request, String scenarioId, Integer baseCalendarYear) {
    LocalDate today = LocalDate.now(clock);
    DamagesInput input = mapper.toInput(request, baseCalendarYear, today);
    String id = scenarioId == null || scenarioId.isBlank() ? DEFAULT_SCENARIO : scenarioId;

    return timed(
        "earnings-schedule",
        caseRef(input),
        () -> {
          DamagesResult result = engine.calculate(input, today);
          ScenarioProjection scenario =
              result.scenario(id).orElseThrow(() -> new ScenarioNotFoundException(id));
          return engine
              .schedules()
              .earnings(
                  engine.earningsCase(input, today),
                  scenario.retirementAge(),
                  input.baseCalendarYear());
        });
  }

  public List<DetailedLcpRow> lifeCarePlanSchedule(
      DamagesRequest request, Integer baseCalendarYear) {
    DamagesInput input = mapper.toInput(request, baseCalendarYear, LocalDate.now(clock));
    EarningsParams params = input.earningsParams();
    return timed(
        "life-care-plan-schedule",
        caseRef(input),
        () ->
            engine
                .schedules()
                .lifeCarePlan(
                    input.lcpItems(),
                    params.discountRatePct(),
                    params.presentValueEnabled(),
                    input.baseCalendarYear()));
  }

  public List<DetailedHouseholdRow> householdSchedule(
      DamagesRequest request, Integer baseCalendarYear) {
    LocalDate today = LocalDate.now(clock);
    DamagesInput input = mapper.toInput(request, baseCalendarYear, today);
    return timed(
        "household-schedule",
        caseRef(input),
        () -> {
          double yfs = engine.earningsCase(input, today).dateCalc().derivedYfs();
          return engine
              .schedules()
              .household(
                  input.householdServices(),
                  yfs,
                  input.earningsParams().presentValueEnabled(),
                  input.baseCalendarYear());
        });
  }

  public CpiCategoryTable cpiTable() {
    return cpiTable;
  }

  public CpiCategory cpiCategory(String categoryId) {
    return cpiTable
        .find(categoryId)
        .orElseThrow(() -> new UnknownCpiCategoryException(categoryId));
  }

  private <T> T timed(String operation, String caseRef, Supplier<T> work) {
    Timer timer =
        Timer.builder(TIMER_NAME)
            .description("Damages engine run time")
            .tag("operation", operation)
            .register(meterRegistry);
    try {
      return timer.record(work);
    } catch (BaseException e) {
      throw e;
    } catch (RuntimeException e) {
      Counter.builder(FAILURE_COUNTER_NAME)
          .description("Unexpected damages engine failures")
          .tag("operation", operation)
          .register(meterRegistry)
          .increment();
      log.error("[Damages] Calculation failed. operation={}, fileNumber={}", operation, caseRef, e);
      throw new DamagesCalculationException(caseRef, e);
    }
  }

  private static String caseRef(DamagesInput input) {
    String fileNumber = input.caseInfo().fileNumber();
    return fileNumber.isBlank() ? "unnumbered" : fileNumber;
  }
}
