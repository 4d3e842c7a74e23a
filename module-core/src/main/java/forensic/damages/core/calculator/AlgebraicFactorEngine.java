package forensic.damages.core.calculator;

import forensic.damages.core.domain.model.AlgebraicFactors;
import forensic.damages.core.domain.model.DateCalc;
import forensic.damages.core.domain.model.EarningsParams;
import forensic.damages.core.domain.model.FringeBenefits;
import forensic.damages.core.domain.model.TaxCombinationMethod;
import java.util.Objects;

/**
 * Tinari Algebraic Method: reduces the adjustment chain to the Adjusted Income Factor (AIF), the
 * share of each gross-earnings dollar that is compensable loss.
 *
 * <h3>Order of application (non-commutative)</h3>
 *
 * <ol>
 *   <li>WLF = WLE / YFS (0 when YFS ≤ 0)
 *   <li>UF = UR × (1 − UI replacement); unemployment-adjusted base = WLF × (1 − UF)
 *   <li>gross with fringes = unemployment-adjusted base × (1 + FB)
 *   <li>tax = unemployment-adjusted base × combined rate; fringes are never taxed
 *   <li>after-tax compensation = gross with fringes − tax
 *   <li>wrongful death only: AIF = after-tax compensation × (1 − PC), once per era
 * </ol>
 *
 * <pre>
 * AIF = {[(WLF × (1 − UF)) × (1 + FB)] − [(WLF × (1 − UF)) × TL]} × (1 − PC)
 * </pre>
 */
public class AlgebraicFactorEngine {

  private final TaxCombinationMethod taxCombination;

  public AlgebraicFactorEngine(TaxCombinationMethod taxCombination) {
    this.taxCombination = Objects.requireNonNull(taxCombination, "taxCombination");
  }

  public AlgebraicFactors calculate(
      EarningsParams params, DateCalc dateCalc, boolean unionMode) {
    return calculate(params, dateCalc.derivedYfs(), unionMode);
  }

  /**
   * @param params earnings assumptions
   * @param yfs Years to Final Separation for the WLF
   * @param unionMode true to derive the fringe rate from itemized flat amounts
   */
  public AlgebraicFactors calculate(EarningsParams params, double yfs, boolean unionMode) {
    double wlf = yfs > 0 ? params.wle() / yfs : 0;

    double unemploymentFactor =
        (params.unemploymentRatePct() / 100) * (1 - params.uiReplacementRatePct() / 100);

    double combinedTaxRate =
        taxCombination.combine(params.fedTaxRatePct(), params.stateTaxRatePct());
    double afterTaxFactor = 1 - combinedTaxRate;

    FringeBenefits fringe = params.fringeBenefits();
    double flatFringeAmount = 0;
    double fringeFactor = 1;
    if (fringe.enabled()) {
      if (unionMode) {
        flatFringeAmount = fringe.flatTotal();
        double effectiveRate =
            params.baseEarnings() > 0 ? flatFringeAmount / params.baseEarnings() : 0;
        fringeFactor = 1 + effectiveRate;
      } else {
        fringeFactor = 1 + fringe.ratePct() / 100;
      }
    }

    double era1Pc = params.isWrongfulDeath() ? params.personalConsumption().era1Pct() / 100 : 0;
    double era2Pc = params.isWrongfulDeath() ? params.personalConsumption().era2Pct() / 100 : 0;

    double worklifeAdjustedBase = wlf;
    double unemploymentAdjustedBase = worklifeAdjustedBase * (1 - unemploymentFactor);
    double grossCompensationWithFringes = unemploymentAdjustedBase * fringeFactor;
    double taxOnBaseEarnings = unemploymentAdjustedBase * combinedTaxRate;
    double afterTaxCompensation = grossCompensationWithFringes - taxOnBaseEarnings;

    double era1Aif = afterTaxCompensation * (1 - era1Pc);
    double era2Aif = afterTaxCompensation * (1 - era2Pc);
    double fullMultiplier = params.isWrongfulDeath() ? era1Aif : afterTaxCompensation;

    // actual earnings already reflect worklife and unemployment
    double realizedMultiplier = afterTaxFactor * fringeFactor;

    return new AlgebraicFactors(
        yfs,
        wlf,
        unemploymentFactor,
        worklifeAdjustedBase,
        unemploymentAdjustedBase,
        fringeFactor,
        flatFringeAmount,
        grossCompensationWithFringes,
        combinedTaxRate,
        afterTaxFactor,
        taxOnBaseEarnings,
        afterTaxCompensation,
        era1Pc,
        era2Pc,
        era1Aif,
        era2Aif,
        fullMultiplier,
        realizedMultiplier);
  }

  /** WLF as a percentage, the way it is quoted in reports. */
  public double workLifeFactorPercent(EarningsParams params, double yfs) {
    return yfs > 0 ? params.wle() / yfs * 100 : 0;
  }
}
