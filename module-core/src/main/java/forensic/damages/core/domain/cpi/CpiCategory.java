package forensic.damages.core.domain.cpi;

/**
 * Medical-care CPI category.
 *
 * @param id stable key referenced by plan items
 * @param label display name
 * @param ratePct annual inflation rate in percent
 */
public record CpiCategory(String id, String label, double ratePct) {

  public CpiCategory {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id cannot be null or blank");
    }
    if (!Double.isFinite(ratePct)) {
      throw new IllegalArgumentException("ratePct must be finite, got: " + ratePct);
    }
  }
}
