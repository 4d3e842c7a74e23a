package forensic.damages.core.domain.model;

/** Date from which Years to Final Separation is counted. */
public enum YfsOrigin {
  /** retirement age minus age at injury */
  INJURY_DATE,
  /** retirement age minus age at trial */
  TRIAL_DATE
}
