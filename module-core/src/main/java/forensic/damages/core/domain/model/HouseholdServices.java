package forensic.damages.core.domain.model;

/**
 * Lost household-services capacity.
 *
 * @param active whether the claim is made at all
 * @param hoursPerWeek weekly hours of services no longer performed
 * @param hourlyRate replacement cost per hour
 * @param growthRatePct annual growth of the hourly rate
 * @param discountRatePct present-value discount rate
 */
public record HouseholdServices(
    boolean active,
    double hoursPerWeek,
    double hourlyRate,
    double growthRatePct,
    double discountRatePct) {

  public static final HouseholdServices INACTIVE = new HouseholdServices(false, 0, 25.00, 3.0, 4.25);

  public double baseAnnualValue() {
    return hoursPerWeek * 52 * hourlyRate;
  }
}
