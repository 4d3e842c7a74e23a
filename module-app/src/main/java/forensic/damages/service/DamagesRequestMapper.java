package forensic.damages.service;

import forensic.damages.controller.dto.CaseInfoRequest;
import forensic.damages.controller.dto.DamagesRequest;
import forensic.damages.controller.dto.EarningsRequest;
import forensic.damages.controller.dto.HouseholdRequest;
import forensic.damages.controller.dto.LcpItemRequest;
import forensic.damages.core.DamagesInput;
import forensic.damages.core.domain.model.CaseInfo;
import forensic.damages.core.domain.model.EarningsParams;
import forensic.damages.core.domain.model.EraSplit;
import forensic.damages.core.domain.model.FringeBenefits;
import forensic.damages.core.domain.model.HouseholdServices;
import forensic.damages.core.domain.model.LcpFrequency;
import forensic.damages.core.domain.model.LcpItem;
import forensic.damages.core.domain.model.ManualActuals;
import forensic.damages.core.domain.model.PersonalConsumption;
import forensic.damages.core.parse.CaseDates;
import forensic.damages.core.parse.LcpFrequencies;
import forensic.damages.core.parse.ZeroFallback;
import forensic.damages.error.exception.InvalidDamagesInputException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Converts the string-typed entry form into engine input.
 *
 * <p>Omitted numbers take the engine's starting assumptions. Blank dates stay absent; dates and
 * frequency types that are present but unreadable are rejected with {@link
 * InvalidDamagesInputException}.
 */
@Component
public class DamagesRequestMapper {

  private static final int DEFAULT_DURATION_YEARS = 1;

  /**
   * @param request submitted case
   * @param baseCalendarYear query override for the first future schedule year, nullable
   * @param today valuation day, supplies the base year when none is given
   */
  public DamagesInput toInput(DamagesRequest request, Integer baseCalendarYear, LocalDate today) {
    int baseYear =
        baseCalendarYear != null
            ? baseCalendarYear
            : request.baseCalendarYear() != null ? request.baseCalendarYear() : today.getYear();
    return new DamagesInput(
        caseInfo(request.caseInfo()),
        earningsParams(request.earnings()),
        ManualActuals.of(request.pastActuals()),
        request.unionMode(),
        household(request.household()),
        lcpItems(request.lcpItems()),
        request.selectedScenario(),
        request.excludedScenarios(),
        baseYear);
  }

  CaseInfo caseInfo(CaseInfoRequest c) {
    return new CaseInfo(
        nullToEmpty(c.plaintiff()),
        nullToEmpty(c.fileNumber()),
        nullToEmpty(c.attorney()),
        nullToEmpty(c.lawFirm()),
        nullToEmpty(c.gender()),
        date("dateOfBirth", c.dateOfBirth()),
        date("dateOfInjury", c.dateOfInjury()),
        date("dateOfTrial", c.dateOfTrial()),
        c.retirementAge() != null ? c.retirementAge() : CaseInfo.DEFAULT_RETIREMENT_AGE,
        ZeroFallback.orZero(c.lifeExpectancy()),
        nullToEmpty(c.jurisdiction()));
  }

  EarningsParams earningsParams(EarningsRequest e) {
    EarningsParams.Builder builder =
        EarningsParams.builder()
            .baseEarnings(ZeroFallback.orZero(e.baseEarnings()))
            .residualEarnings(ZeroFallback.orZero(e.residualEarnings()))
            .wle(ZeroFallback.orZero(e.wle()))
            .pjiAge(e.pjiAge());
    if (e.wageGrowth() != null) {
      builder.wageGrowthPct(e.wageGrowth());
    }
    if (e.discountRate() != null) {
      builder.discountRatePct(e.discountRate());
    }
    if (e.unemploymentRate() != null) {
      builder.unemploymentRatePct(e.unemploymentRate());
    }
    if (e.uiReplacementRate() != null) {
      builder.uiReplacementRatePct(e.uiReplacementRate());
    }
    if (e.fedTaxRate() != null) {
      builder.fedTaxRatePct(e.fedTaxRate());
    }
    if (e.stateTaxRate() != null) {
      builder.stateTaxRatePct(e.stateTaxRate());
    }
    if (e.caseType() != null) {
      builder.caseType(e.caseType());
    }
    if (e.presentValue() != null) {
      builder.presentValueEnabled(e.presentValue());
    }

    builder.fringeBenefits(
        new FringeBenefits(
            e.fringeEnabled() == null || e.fringeEnabled(),
            e.fringeRate() != null ? e.fringeRate() : FringeBenefits.DEFAULT_RATE_PCT,
            ZeroFallback.orZero(e.pension()),
            ZeroFallback.orZero(e.healthWelfare()),
            ZeroFallback.orZero(e.annuity()),
            ZeroFallback.orZero(e.clothingAllowance()),
            ZeroFallback.orZero(e.otherBenefits())));

    double era1Consumption = ZeroFallback.orZero(e.personalConsumptionEra1());
    double era2Consumption =
        e.personalConsumptionEra2() != null ? e.personalConsumptionEra2() : era1Consumption;
    builder.personalConsumption(new PersonalConsumption(era1Consumption, era2Consumption));

    if (e.eraSplitYear() != null) {
      // era rates fall back to the single growth rate
      double growth = builder.build().wageGrowthPct();
      builder.eraSplit(
          new EraSplit(
              e.eraSplitYear(),
              e.era1WageGrowth() != null ? e.era1WageGrowth() : growth,
              e.era2WageGrowth() != null ? e.era2WageGrowth() : growth));
    }
    return builder.build();
  }

  HouseholdServices household(HouseholdRequest h) {
    if (h == null) {
      return HouseholdServices.INACTIVE;
    }
    HouseholdServices defaults = HouseholdServices.INACTIVE;
    return new HouseholdServices(
        h.active(),
        ZeroFallback.orZero(h.hoursPerWeek()),
        h.hourlyRate() != null ? h.hourlyRate() : defaults.hourlyRate(),
        h.growthRate() != null ? h.growthRate() : defaults.growthRatePct(),
        h.discountRate() != null ? h.discountRate() : defaults.discountRatePct());
  }

  List<LcpItem> lcpItems(List<LcpItemRequest> items) {
    if (items == null) {
      return List.of();
    }
    List<LcpItem> result = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      LcpItemRequest item = items.get(i);
      result.add(
          new LcpItem(
              item.id() != null ? item.id() : i + 1,
              item.name(),
              item.categoryId(),
              item.baseCost(),
              item.cpiOverride(),
              frequency(item)));
    }
    return result;
  }

  private LcpFrequency frequency(LcpItemRequest item) {
    return LcpFrequencies.fromLegacy(
            item.freqType(),
            item.startYear(),
            item.endYear(),
            item.duration() != null ? item.duration() : DEFAULT_DURATION_YEARS,
            item.recurrenceInterval(),
            item.useCustomYears(),
            item.customYears())
        .orElseThrow(
            () ->
                new InvalidDamagesInputException(
                    "freqType '" + item.freqType() + "' of item '" + item.name() + "'"));
  }

  private static LocalDate date(String field, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    return CaseDates.parse(raw)
        .orElseThrow(() -> new InvalidDamagesInputException(field + " '" + raw + "'"));
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
