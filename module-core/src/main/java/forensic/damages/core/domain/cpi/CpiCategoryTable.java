package forensic.damages.core.domain.cpi;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Versioned, immutable {@code category id → CPI rate} table.
 *
 * <p>Handed to the life-care-plan valuator as a constructor dependency so alternate tables can be
 * swapped in per deployment or per test.
 */
public final class CpiCategoryTable {

  public static final String CUSTOM_CATEGORY_ID = "custom";

  private static final CpiCategoryTable DEFAULTS =
      new CpiCategoryTable(
          "2021-bls",
          List.of(
              new CpiCategory("evals", "Physician Evals & Home Care", 2.88),
              new CpiCategory("rx", "Rx / Medical Commodities", 1.65),
              new CpiCategory("surgery", "Hospital/Surgical Services", 4.07),
              new CpiCategory("therapy", "Therapy & Treatments", 1.62),
              new CpiCategory("transport", "Transportation", 4.32),
              new CpiCategory("home", "Home Modifications", 4.16),
              new CpiCategory("educ", "Education/Training", 2.61),
              new CpiCategory(CUSTOM_CATEGORY_ID, "Custom Rate", 0.00)));

  private final String version;
  private final Map<String, CpiCategory> categories;

  public CpiCategoryTable(String version, Collection<CpiCategory> categories) {
    if (version == null || version.isBlank()) {
      throw new IllegalArgumentException("version cannot be null or blank");
    }
    Map<String, CpiCategory> byId = new LinkedHashMap<>();
    for (CpiCategory category : categories) {
      if (byId.put(category.id(), category) != null) {
        throw new IllegalArgumentException("duplicate CPI category id: " + category.id());
      }
    }
    this.version = version;
    this.categories = Collections.unmodifiableMap(byId);
  }

  /** Published category rates shipped with the engine. */
  public static CpiCategoryTable defaults() {
    return DEFAULTS;
  }

  public String version() {
    return version;
  }

  public List<CpiCategory> categories() {
    return List.copyOf(categories.values());
  }

  public Optional<CpiCategory> find(String categoryId) {
    return Optional.ofNullable(categoryId).map(categories::get);
  }

  public OptionalDouble rateFor(String categoryId) {
    return find(categoryId).map(c -> OptionalDouble.of(c.ratePct())).orElse(OptionalDouble.empty());
  }

  public boolean contains(String categoryId) {
    return find(categoryId).isPresent();
  }
}
