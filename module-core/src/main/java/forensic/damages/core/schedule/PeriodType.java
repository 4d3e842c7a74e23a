package forensic.damages.core.schedule;

public enum PeriodType {
  PAST,
  FUTURE
}
