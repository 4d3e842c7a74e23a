package forensic.damages.core.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered Tinari factor breakdown. Every intermediate value is a dimensionless fraction of gross
 * earnings (gross earnings = 1.0).
 *
 * <p>Order of application: WLF → (1 − unemployment factor) → (1 + fringe) → minus tax on the
 * unemployment-adjusted base → (1 − personal consumption).
 *
 * @param yfs Years to Final Separation used for the WLF
 * @param wlf work-life factor, WLE / YFS
 * @param unemploymentFactor unemployment rate × (1 − UI replacement rate)
 * @param worklifeAdjustedBase 1.0 × WLF
 * @param unemploymentAdjustedBase worklife base × (1 − unemployment factor)
 * @param fringeFactor 1 + effective fringe rate
 * @param flatFringeAmount union-mode itemized fringe total in dollars, 0 in standard mode
 * @param grossCompensationWithFringes unemployment-adjusted base × fringe factor
 * @param combinedTaxRate merged federal/state rate
 * @param afterTaxFactor 1 − combined tax rate
 * @param taxOnBaseEarnings unemployment-adjusted base × combined tax rate
 * @param afterTaxCompensation gross with fringes − tax on base
 * @param era1PersonalConsumptionFactor era-1 consumption fraction (0 unless wrongful death)
 * @param era2PersonalConsumptionFactor era-2 consumption fraction (0 unless wrongful death)
 * @param era1Aif adjusted income factor for era 1
 * @param era2Aif adjusted income factor for era 2
 * @param fullMultiplier headline AIF (era 1 for wrongful death, after-tax compensation otherwise)
 * @param realizedMultiplier factor applied to manually entered actual earnings
 */
public record AlgebraicFactors(
    double yfs,
    double wlf,
    double unemploymentFactor,
    double worklifeAdjustedBase,
    double unemploymentAdjustedBase,
    double fringeFactor,
    double flatFringeAmount,
    double grossCompensationWithFringes,
    double combinedTaxRate,
    double afterTaxFactor,
    double taxOnBaseEarnings,
    double afterTaxCompensation,
    double era1PersonalConsumptionFactor,
    double era2PersonalConsumptionFactor,
    double era1Aif,
    double era2Aif,
    double fullMultiplier,
    double realizedMultiplier) {

  public double aif(int era) {
    return era == 1 ? era1Aif : era2Aif;
  }

  /**
   * Factor table for reports: each cumulative step in application order, priced against {@code
   * grossEarnings}. Personal-consumption rows appear only when a consumption factor is non-zero.
   */
  public List<FactorStep> breakdown(double grossEarnings) {
    List<FactorStep> steps = new ArrayList<>();
    steps.add(step("Gross earnings", 1.0, grossEarnings));
    steps.add(step("Worklife-adjusted base", worklifeAdjustedBase, grossEarnings));
    steps.add(step("Unemployment-adjusted base", unemploymentAdjustedBase, grossEarnings));
    steps.add(
        step("Gross compensation with fringe benefits", grossCompensationWithFringes, grossEarnings));
    steps.add(step("Tax on base earnings", taxOnBaseEarnings, grossEarnings));
    steps.add(step("After-tax compensation", afterTaxCompensation, grossEarnings));
    if (era1PersonalConsumptionFactor != 0 || era2PersonalConsumptionFactor != 0) {
      steps.add(step("Adjusted income factor (era 1)", era1Aif, grossEarnings));
      steps.add(step("Adjusted income factor (era 2)", era2Aif, grossEarnings));
    }
    return List.copyOf(steps);
  }

  private static FactorStep step(String label, double fraction, double grossEarnings) {
    return new FactorStep(label, fraction, fraction * grossEarnings);
  }
}
