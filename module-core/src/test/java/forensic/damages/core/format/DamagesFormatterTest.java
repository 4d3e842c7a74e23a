package forensic.damages.core.format;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("DamagesFormatter")
class DamagesFormatterTest {

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "1234567.89, '$1,234,568'",
    "0, '$0'",
    "999.4, '$999'",
  })
  @DisplayName("whole-dollar currency")
  void usd(double amount, String expected) {
    assertThat(DamagesFormatter.usd(amount)).isEqualTo(expected);
  }

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({"0.8, '80.00%'", "0.58672, '58.67%'", "0, '0.00%'"})
  @DisplayName("fraction as a two-decimal percentage")
  void percent(double fraction, String expected) {
    assertThat(DamagesFormatter.percent(fraction)).isEqualTo(expected);
  }
}
