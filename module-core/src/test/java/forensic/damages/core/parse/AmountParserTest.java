package forensic.damages.core.parse;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.OptionalDouble;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("AmountParser")
class AmountParserTest {

  @ParameterizedTest(name = "\"{0}\" -> {1}")
  @CsvSource({
    "'25000', 25000",
    "'$25,000', 25000",
    "' 1,234.50 ', 1234.5",
    "'-500', -500",
    "'0', 0",
  })
  @DisplayName("accepts plain and dollar-formatted amounts")
  void parses(String raw, double expected) {
    assertThat(AmountParser.parse(raw)).hasValue(expected);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   ", "abc", "$", "NaN", "Infinity", "12abc"})
  @DisplayName("rejects blank, non-numeric and non-finite input")
  void rejects(String raw) {
    assertThat(AmountParser.parse(raw)).isEmpty();
  }

  @Test
  @DisplayName("zero fallback is explicit at the call site")
  void zeroFallback() {
    assertThat(ZeroFallback.orZero(AmountParser.parse("oops"))).isZero();
    assertThat(ZeroFallback.orZero(OptionalDouble.of(3.5))).isEqualTo(3.5);
    assertThat(ZeroFallback.orZero((Double) null)).isZero();
    assertThat(ZeroFallback.orZero(Double.NaN)).isZero();
  }
}
