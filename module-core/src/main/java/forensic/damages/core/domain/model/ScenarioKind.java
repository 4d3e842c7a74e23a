package forensic.damages.core.domain.model;

public enum ScenarioKind {
  WLE,
  STANDARD_AGE,
  PJI
}
