package forensic.damages.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import forensic.damages.controller.dto.DamagesRequest;
import forensic.damages.core.DamagesInput;
import forensic.damages.core.domain.model.CaseInfo;
import forensic.damages.core.domain.model.EarningsParams;
import forensic.damages.core.domain.model.FringeBenefits;
import forensic.damages.core.domain.model.HouseholdServices;
import forensic.damages.core.domain.model.LcpFrequency;
import forensic.damages.core.domain.model.YearRange;
import forensic.damages.error.exception.InvalidDamagesInputException;
import java.io.InputStream;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DamagesRequestMapper")
class DamagesRequestMapperTest {

  private static final LocalDate TODAY = LocalDate.of(2025, 3, 15);

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final DamagesRequestMapper mapper = new DamagesRequestMapper();

  private DamagesRequest fixture() throws Exception {
    try (InputStream in = getClass().getResourceAsStream("/fixtures/damages-request.json")) {
      return objectMapper.readValue(in, DamagesRequest.class);
    }
  }

  private DamagesRequest request(String json) throws Exception {
    return objectMapper.readValue(json, DamagesRequest.class);
  }

  @Nested
  @DisplayName("full entry form")
  class FullForm {

    @Test
    @DisplayName("parses US and ISO dates")
    void dates() throws Exception {
      CaseInfo caseInfo = mapper.toInput(fixture(), null, TODAY).caseInfo();

      assertThat(caseInfo.dateOfBirth()).isEqualTo(LocalDate.of(1980, 4, 12));
      assertThat(caseInfo.dateOfInjury()).isEqualTo(LocalDate.of(2021, 6, 30));
      assertThat(caseInfo.dateOfTrial()).isEqualTo(LocalDate.of(2024, 11, 4));
      assertThat(caseInfo.fileNumber()).isEqualTo("2024-017");
    }

    @Test
    @DisplayName("omitted rates take the standard starting assumptions")
    void defaults() throws Exception {
      EarningsParams params = mapper.toInput(fixture(), null, TODAY).earningsParams();
      EarningsParams standard = EarningsParams.builder().build();

      assertThat(params.baseEarnings()).isEqualTo(58_000);
      assertThat(params.wageGrowthPct()).isEqualTo(standard.wageGrowthPct());
      assertThat(params.discountRatePct()).isEqualTo(standard.discountRatePct());
      assertThat(params.fedTaxRatePct()).isEqualTo(standard.fedTaxRatePct());
      assertThat(params.fringeBenefits().enabled()).isTrue();
      assertThat(params.fringeBenefits().ratePct()).isEqualTo(FringeBenefits.DEFAULT_RATE_PCT);
      assertThat(params.presentValueEnabled()).isTrue();
      assertThat(params.pjiAge()).isEqualTo(62.0);
      assertThat(params.hasEraSplit()).isFalse();
    }

    @Test
    @DisplayName("life care plan items convert to frequencies")
    void lcpItems() throws Exception {
      DamagesInput input = mapper.toInput(fixture(), null, TODAY);

      assertThat(input.lcpItems()).hasSize(2);
      assertThat(input.lcpItems().get(0).frequency())
          .isEqualTo(new LcpFrequency.Annual(new YearRange(1, 10)));
      assertThat(input.lcpItems().get(1).frequency()).isEqualTo(new LcpFrequency.OneTime(4));
    }

    @Test
    @DisplayName("actuals, household and scenario selection carry through")
    void passThrough() throws Exception {
      DamagesInput input = mapper.toInput(fixture(), null, TODAY);

      assertThat(input.actuals().amountFor(2022)).hasValue(30_000);
      assertThat(input.householdServices())
          .isEqualTo(new HouseholdServices(true, 8, 25, 3, 4.25));
      assertThat(input.selectedScenario()).isEqualTo("age67");
      assertThat(input.excludedScenarios()).containsExactly("age70");
    }
  }

  @Nested
  @DisplayName("base calendar year")
  class BaseCalendarYear {

    @Test
    @DisplayName("query value wins over the request body")
    void queryWins() throws Exception {
      assertThat(mapper.toInput(fixture(), 2030, TODAY).baseCalendarYear()).isEqualTo(2030);
    }

    @Test
    @DisplayName("request body value is used when no query value is given")
    void bodyValue() throws Exception {
      assertThat(mapper.toInput(fixture(), null, TODAY).baseCalendarYear()).isEqualTo(2025);
    }

    @Test
    @DisplayName("falls back to the current year")
    void currentYear() throws Exception {
      DamagesRequest request = request("{\"caseInfo\":{},\"earnings\":{}}");

      assertThat(mapper.toInput(request, null, TODAY).baseCalendarYear()).isEqualTo(2025);
    }
  }

  @Nested
  @DisplayName("sparse input")
  class Sparse {

    @Test
    @DisplayName("empty form maps to a zeroed case with inactive household services")
    void emptyForm() throws Exception {
      DamagesInput input = mapper.toInput(request("{\"caseInfo\":{},\"earnings\":{}}"), null, TODAY);

      assertThat(input.caseInfo().hasAllDates()).isFalse();
      assertThat(input.caseInfo().retirementAge()).isEqualTo(CaseInfo.DEFAULT_RETIREMENT_AGE);
      assertThat(input.earningsParams().baseEarnings()).isZero();
      assertThat(input.householdServices()).isEqualTo(HouseholdServices.INACTIVE);
      assertThat(input.lcpItems()).isEmpty();
    }

    @Test
    @DisplayName("era growth rates default to the single growth rate")
    void eraSplitDefaults() throws Exception {
      DamagesRequest request =
          request(
              "{\"caseInfo\":{},\"earnings\":{\"wageGrowth\":2.5,\"eraSplitYear\":2024,"
                  + "\"era2WageGrowth\":4.0}}");

      EarningsParams params = mapper.toInput(request, null, TODAY).earningsParams();

      assertThat(params.eraSplit().splitYear()).isEqualTo(2024);
      assertThat(params.eraSplit().era1WageGrowthPct()).isEqualTo(2.5);
      assertThat(params.eraSplit().era2WageGrowthPct()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("second consumption era defaults to the first")
    void consumptionEra() throws Exception {
      DamagesRequest request =
          request(
              "{\"caseInfo\":{},\"earnings\":{\"caseType\":\"WRONGFUL_DEATH\","
                  + "\"personalConsumptionEra1\":22}}");

      EarningsParams params = mapper.toInput(request, null, TODAY).earningsParams();

      assertThat(params.isWrongfulDeath()).isTrue();
      assertThat(params.personalConsumption().era2Pct()).isEqualTo(22);
    }

    @Test
    @DisplayName("union fringe items without values count as zero")
    void unionFringes() throws Exception {
      DamagesRequest request =
          request(
              "{\"caseInfo\":{},\"unionMode\":true,"
                  + "\"earnings\":{\"pension\":9000,\"healthWelfare\":7000}}");

      DamagesInput input = mapper.toInput(request, null, TODAY);

      assertThat(input.unionMode()).isTrue();
      assertThat(input.earningsParams().fringeBenefits().flatTotal()).isEqualTo(16_000);
    }
  }

  @Nested
  @DisplayName("rejected input")
  class Rejected {

    @Test
    @DisplayName("unreadable date")
    void badDate() throws Exception {
      DamagesRequest request =
          request("{\"caseInfo\":{\"dateOfInjury\":\"2/30/2021\"},\"earnings\":{}}");

      assertThatThrownBy(() -> mapper.toInput(request, null, TODAY))
          .isInstanceOf(InvalidDamagesInputException.class)
          .hasMessageContaining("dateOfInjury");
    }

    @Test
    @DisplayName("unknown frequency type")
    void badFrequency() throws Exception {
      DamagesRequest request =
          request(
              "{\"caseInfo\":{},\"earnings\":{},"
                  + "\"lcpItems\":[{\"name\":\"Wheelchair\",\"baseCost\":900,\"freqType\":\"weekly\"}]}");

      assertThatThrownBy(() -> mapper.toInput(request, null, TODAY))
          .isInstanceOf(InvalidDamagesInputException.class)
          .hasMessageContaining("weekly");
    }
  }
}
