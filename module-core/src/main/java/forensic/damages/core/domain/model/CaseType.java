package forensic.damages.core.domain.model;

/** Case variant. Only wrongful-death cases deduct the decedent's personal consumption. */
public enum CaseType {
  PERSONAL_INJURY("Personal Injury"),
  WRONGFUL_DEATH("Wrongful Death");

  private final String description;

  CaseType(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
