package forensic.damages.core.domain.model;

import java.util.Objects;

/**
 * Economic assumptions for the earnings-loss calculation.
 *
 * <p>All rates are in percent as entered by the economist (3.5 means 3.5%). Money amounts are
 * annual dollars.
 *
 * @param baseEarnings pre-injury ("but-for") annual earnings
 * @param residualEarnings post-injury earning capacity
 * @param wle work-life expectancy in years
 * @param wageGrowthPct annual wage growth
 * @param discountRatePct present-value discount rate
 * @param fringeBenefits fringe inputs (percentage or itemized)
 * @param unemploymentRatePct unemployment rate
 * @param uiReplacementRatePct share of wages replaced by unemployment insurance
 * @param fedTaxRatePct federal income tax rate
 * @param stateTaxRatePct state income tax rate
 * @param caseType personal injury or wrongful death
 * @param personalConsumption consumption rates, read only for wrongful death
 * @param eraSplit explicit growth era boundary, nullable
 * @param presentValueEnabled whether future amounts are discounted
 * @param pjiAge Permanent-Job-Incapacity age scenario, nullable
 */
public record EarningsParams(
    double baseEarnings,
    double residualEarnings,
    double wle,
    double wageGrowthPct,
    double discountRatePct,
    FringeBenefits fringeBenefits,
    double unemploymentRatePct,
    double uiReplacementRatePct,
    double fedTaxRatePct,
    double stateTaxRatePct,
    CaseType caseType,
    PersonalConsumption personalConsumption,
    EraSplit eraSplit,
    boolean presentValueEnabled,
    Double pjiAge) {

  public EarningsParams {
    Objects.requireNonNull(fringeBenefits, "fringeBenefits");
    Objects.requireNonNull(caseType, "caseType");
    Objects.requireNonNull(personalConsumption, "personalConsumption");
  }

  public boolean isWrongfulDeath() {
    return caseType == CaseType.WRONGFUL_DEATH;
  }

  public boolean hasEraSplit() {
    return eraSplit != null;
  }

  public boolean hasPji() {
    return pjiAge != null;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Defaults mirror the economist's standard starting assumptions. */
  public static class Builder {
    private double baseEarnings;
    private double residualEarnings;
    private double wle;
    private double wageGrowthPct = 3.50;
    private double discountRatePct = 4.25;
    private FringeBenefits fringeBenefits =
        FringeBenefits.percentage(FringeBenefits.DEFAULT_RATE_PCT);
    private double unemploymentRatePct = 4.2;
    private double uiReplacementRatePct = 40.0;
    private double fedTaxRatePct = 15.0;
    private double stateTaxRatePct = 4.5;
    private CaseType caseType = CaseType.PERSONAL_INJURY;
    private PersonalConsumption personalConsumption = PersonalConsumption.NONE;
    private EraSplit eraSplit;
    private boolean presentValueEnabled = true;
    private Double pjiAge;

    public Builder baseEarnings(double baseEarnings) {
      this.baseEarnings = baseEarnings;
      return this;
    }

    public Builder residualEarnings(double residualEarnings) {
      this.residualEarnings = residualEarnings;
      return this;
    }

    public Builder wle(double wle) {
      this.wle = wle;
      return this;
    }

    public Builder wageGrowthPct(double wageGrowthPct) {
      this.wageGrowthPct = wageGrowthPct;
      return this;
    }

    public Builder discountRatePct(double discountRatePct) {
      this.discountRatePct = discountRatePct;
      return this;
    }

    public Builder fringeBenefits(FringeBenefits fringeBenefits) {
      this.fringeBenefits = fringeBenefits;
      return this;
    }

    public Builder fringeRatePct(double fringeRatePct) {
      this.fringeBenefits = FringeBenefits.percentage(fringeRatePct);
      return this;
    }

    public Builder unemploymentRatePct(double unemploymentRatePct) {
      this.unemploymentRatePct = unemploymentRatePct;
      return this;
    }

    public Builder uiReplacementRatePct(double uiReplacementRatePct) {
      this.uiReplacementRatePct = uiReplacementRatePct;
      return this;
    }

    public Builder fedTaxRatePct(double fedTaxRatePct) {
      this.fedTaxRatePct = fedTaxRatePct;
      return this;
    }

    public Builder stateTaxRatePct(double stateTaxRatePct) {
      this.stateTaxRatePct = stateTaxRatePct;
      return this;
    }

    public Builder caseType(CaseType caseType) {
      this.caseType = caseType;
      return this;
    }

    public Builder personalConsumption(PersonalConsumption personalConsumption) {
      this.personalConsumption = personalConsumption;
      return this;
    }

    public Builder eraSplit(EraSplit eraSplit) {
      this.eraSplit = eraSplit;
      return this;
    }

    public Builder presentValueEnabled(boolean presentValueEnabled) {
      this.presentValueEnabled = presentValueEnabled;
      return this;
    }

    public Builder pjiAge(Double pjiAge) {
      this.pjiAge = pjiAge;
      return this;
    }

    public EarningsParams build() {
      return new EarningsParams(
          baseEarnings,
          residualEarnings,
          wle,
          wageGrowthPct,
          discountRatePct,
          fringeBenefits,
          unemploymentRatePct,
          uiReplacementRatePct,
          fedTaxRatePct,
          stateTaxRatePct,
          caseType,
          personalConsumption,
          eraSplit,
          presentValueEnabled,
          pjiAge);
    }
  }
}
