package forensic.damages;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/** Full context: configuration binding, JSON customization and the engine behind the API. */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Damages API")
class DamagesApiIntegrationTest {

  @Autowired private MockMvc mockMvc;

  private static String fixture() throws Exception {
    return new ClassPathResource("fixtures/damages-request.json")
        .getContentAsString(StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("calculate returns a complete report snapshot")
  void calculate() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/damages/calculate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(fixture()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.data.metadata.calculationMethod").value("tinari-algebraic"))
        .andExpect(jsonPath("$.data.metadata.schemaVersion").value("v10"))
        .andExpect(jsonPath("$.data.metadata.activeScenario").value("age67"))
        .andExpect(jsonPath("$.data.assumptions.actuals['2022']").value("30,000"))
        .andExpect(jsonPath("$.data.assumptions.lcpItems[1].frequency.mode").value("onetime"))
        .andExpect(jsonPath("$.data.assumptions.caseInfo.dateOfTrial").value("2024-11-04"))
        .andExpect(jsonPath("$.data.results.scenarios.length()").value(5))
        .andExpect(jsonPath("$.data.results.scenarios[4].label").value("PJI (Age 62)"))
        .andExpect(jsonPath("$.data.periods[0].type").value("PAST"));
  }

  @Test
  @DisplayName("unknown scenario is a 404 with the error catalogue code")
  void unknownScenario() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/damages/schedules/earnings")
                .param("scenario", "age80")
                .contentType(MediaType.APPLICATION_JSON)
                .content(fixture()))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("C002"));
  }

  @Test
  @DisplayName("unreadable date is a 400")
  void badDate() throws Exception {
    String body = fixture().replace("6/30/2021", "June 30th");

    mockMvc
        .perform(
            post("/api/v1/damages/calculate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("C001"));
  }

  @Test
  @DisplayName("CPI category lookup")
  void cpiCategory() throws Exception {
    mockMvc
        .perform(get("/api/v1/damages/cpi-categories/transport"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.ratePct").value(4.32));
  }
}
