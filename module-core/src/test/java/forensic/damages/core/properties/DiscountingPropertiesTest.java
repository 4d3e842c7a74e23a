package forensic.damages.core.properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import forensic.damages.core.calculator.Discounting;
import net.jqwik.api.Assume;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;

/** Mid-year discounting and growth factors. */
class DiscountingPropertiesTest {

  @Property(tries = 200)
  void discount_is_mid_year_power(
      @ForAll @DoubleRange(min = 0, max = 20) double ratePct,
      @ForAll @IntRange(min = 0, max = 80) int year) {

    double expected = Math.pow(1 + ratePct / 100, -(year + 0.5));

    assertThat(Discounting.midYearFactor(ratePct, year)).isCloseTo(expected, within(1e-12));
  }

  @Property(tries = 200)
  void discount_strictly_decreases_for_positive_rate(
      @ForAll @DoubleRange(min = 0.01, max = 20) double ratePct,
      @ForAll @IntRange(min = 0, max = 80) int year) {

    assertThat(Discounting.midYearFactor(ratePct, year + 1))
        .isLessThan(Discounting.midYearFactor(ratePct, year));
  }

  @Property(tries = 100)
  void disabled_present_value_is_identity(
      @ForAll @DoubleRange(min = 0, max = 20) double ratePct,
      @ForAll @IntRange(min = 0, max = 80) int year) {

    assertThat(Discounting.midYearFactor(ratePct, year, false)).isEqualTo(1.0);
  }

  @Property(tries = 100)
  void growth_compounds(
      @ForAll @DoubleRange(min = -5, max = 15) double ratePct,
      @ForAll @IntRange(min = 0, max = 40) int a,
      @ForAll @IntRange(min = 0, max = 40) int b) {

    Assume.that(ratePct > -100);
    double combined = Discounting.growthFactor(ratePct, a) * Discounting.growthFactor(ratePct, b);

    assertThat(Discounting.growthFactor(ratePct, a + b))
        .isCloseTo(combined, within(1e-9 * Math.max(1, combined)));
  }
}
