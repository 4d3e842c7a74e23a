package forensic.damages.core.domain.model;

/**
 * How federal and state income-tax rates are merged into the single rate levied on the
 * unemployment-adjusted base.
 */
public enum TaxCombinationMethod {

  /** {@code 1 - (1 - fed)(1 - state)}: state tax applies to what federal tax leaves. */
  MULTIPLICATIVE {
    @Override
    public double combine(double fedTaxRatePct, double stateTaxRatePct) {
      return 1 - (1 - fedTaxRatePct / 100) * (1 - stateTaxRatePct / 100);
    }
  },

  /** {@code fed + state}. */
  ADDITIVE {
    @Override
    public double combine(double fedTaxRatePct, double stateTaxRatePct) {
      return (fedTaxRatePct + stateTaxRatePct) / 100;
    }
  };

  /**
   * @param fedTaxRatePct federal rate in percent (15.0 = 15%)
   * @param stateTaxRatePct state rate in percent
   * @return combined rate as a fraction
   */
  public abstract double combine(double fedTaxRatePct, double stateTaxRatePct);
}
