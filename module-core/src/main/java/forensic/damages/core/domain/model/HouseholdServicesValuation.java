package forensic.damages.core.domain.model;

public record HouseholdServicesValuation(double totalNominal, double totalPresentValue) {

  public static final HouseholdServicesValuation ZERO = new HouseholdServicesValuation(0, 0);
}
