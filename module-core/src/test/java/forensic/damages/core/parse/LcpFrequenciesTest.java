package forensic.damages.core.parse;

import static org.assertj.core.api.Assertions.assertThat;

import forensic.damages.core.domain.model.LcpFrequency;
import forensic.damages.core.domain.model.YearRange;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LcpFrequencies")
class LcpFrequenciesTest {

  @Test
  @DisplayName("annual covers start through the later of end year and duration")
  void annual() {
    assertThat(LcpFrequencies.fromLegacy("annual", 2, 4, 5, null, false, null))
        .contains(new LcpFrequency.Annual(new YearRange(2, 6)));
    assertThat(LcpFrequencies.fromLegacy("annual", 2, 9, 5, null, false, null))
        .contains(new LcpFrequency.Annual(new YearRange(2, 9)));
  }

  @Test
  @DisplayName("one-time lands on the start year, clamped to 1")
  void oneTime() {
    assertThat(LcpFrequencies.fromLegacy("onetime", 0, null, 10, null, false, null))
        .contains(new LcpFrequency.OneTime(1));
    assertThat(LcpFrequencies.fromLegacy("ONETIME", 4, null, 1, null, false, null))
        .contains(new LcpFrequency.OneTime(4));
  }

  @Test
  @DisplayName("zero-length range yields no years in every mode")
  void zeroDuration() {
    for (String mode : List.of("annual", "onetime", "recurring")) {
      assertThat(
              LcpFrequencies.fromLegacy(mode, 3, null, 0, null, false, null)
                  .orElseThrow()
                  .activeYears())
          .as(mode)
          .isEmpty();
    }
  }

  @Test
  @DisplayName("recurring keeps its interval, defaulting to every year")
  void recurring() {
    LcpFrequency frequency =
        LcpFrequencies.fromLegacy("recurring", 1, null, 10, 5, false, null).orElseThrow();

    assertThat(frequency.activeYears()).containsExactly(1, 6);
    assertThat(
            LcpFrequencies.fromLegacy("recurring", 1, null, 3, null, false, null)
                .orElseThrow()
                .activeYears())
        .containsExactly(1, 2, 3);
  }

  @Test
  @DisplayName("custom years replace the range whatever the mode")
  void customYears() {
    LcpFrequency frequency =
        LcpFrequencies.fromLegacy("annual", 1, 40, 40, null, true, List.of(10, 3, 3)).orElseThrow();

    assertThat(frequency).isInstanceOf(LcpFrequency.CustomYears.class);
    assertThat(frequency.activeYears()).containsExactly(3, 10);
  }

  @Test
  @DisplayName("custom flag with no years falls back to the mode")
  void emptyCustomYears() {
    assertThat(LcpFrequencies.fromLegacy("onetime", 2, null, 1, null, true, List.of()))
        .contains(new LcpFrequency.OneTime(2));
  }

  @Test
  @DisplayName("unknown mode is rejected")
  void unknownMode() {
    assertThat(LcpFrequencies.fromLegacy("weekly", 1, null, 1, null, false, null)).isEmpty();
    assertThat(LcpFrequencies.fromLegacy(null, 1, null, 1, null, false, null)).isEmpty();
  }
}
