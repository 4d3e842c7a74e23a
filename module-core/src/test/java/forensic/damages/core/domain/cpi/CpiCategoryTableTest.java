package forensic.damages.core.domain.cpi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CpiCategoryTable")
class CpiCategoryTableTest {

  @Test
  @DisplayName("ships the published rates in display order")
  void defaults() {
    CpiCategoryTable table = CpiCategoryTable.defaults();

    assertThat(table.version()).isEqualTo("2021-bls");
    assertThat(table.categories())
        .extracting(CpiCategory::id)
        .containsExactly("evals", "rx", "surgery", "therapy", "transport", "home", "educ", "custom");
    assertThat(table.rateFor("evals")).hasValue(2.88);
    assertThat(table.rateFor("transport")).hasValue(4.32);
    assertThat(table.rateFor(CpiCategoryTable.CUSTOM_CATEGORY_ID)).hasValue(0.0);
  }

  @Test
  @DisplayName("unknown and null ids are absent")
  void unknown() {
    assertThat(CpiCategoryTable.defaults().rateFor("dental")).isEmpty();
    assertThat(CpiCategoryTable.defaults().contains(null)).isFalse();
  }

  @Test
  @DisplayName("duplicate ids are rejected")
  void duplicates() {
    List<CpiCategory> categories =
        List.of(new CpiCategory("rx", "Rx", 1.0), new CpiCategory("rx", "Rx again", 2.0));

    assertThatThrownBy(() -> new CpiCategoryTable("v1", categories))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("rx");
  }
}
