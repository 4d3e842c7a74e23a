package forensic.damages.core.domain.model;

/**
 * Damages under one alternative retirement age.
 *
 * @param id stable id ({@code wle}, {@code age65}, {@code age67}, {@code age70}, {@code pji})
 * @param label display label
 * @param kind how the retirement age was chosen
 * @param retirementAge assumed retirement age
 * @param yfs Years to Final Separation under that age
 * @param wlf work-life factor under that age
 * @param totalPastLoss past earnings loss
 * @param totalFuturePv future earnings loss, present value
 * @param totalEarningsLoss past + future
 * @param grandTotal earnings + household (if active) + life care plan
 * @param included whether the scenario is shown in reports
 */
public record ScenarioProjection(
    String id,
    String label,
    ScenarioKind kind,
    double retirementAge,
    double yfs,
    double wlf,
    double totalPastLoss,
    double totalFuturePv,
    double totalEarningsLoss,
    double grandTotal,
    boolean included) {

  public double wlfPercent() {
    return wlf * 100;
  }

  public ScenarioProjection withIncluded(boolean included) {
    return new ScenarioProjection(
        id,
        label,
        kind,
        retirementAge,
        yfs,
        wlf,
        totalPastLoss,
        totalFuturePv,
        totalEarningsLoss,
        grandTotal,
        included);
  }
}
