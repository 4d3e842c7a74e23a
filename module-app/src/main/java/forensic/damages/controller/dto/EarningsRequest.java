package forensic.damages.controller.dto;

import forensic.damages.core.domain.model.CaseType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Earnings assumptions. Rates are percentages (3.5 means 3.5%); omitted values take the standard
 * starting assumptions.
 */
public record EarningsRequest(
    @PositiveOrZero Double baseEarnings,
    @PositiveOrZero Double residualEarnings,
    @DecimalMin("0") @DecimalMax("80") Double wle,
    @DecimalMin("-20") @DecimalMax("50") Double wageGrowth,
    @DecimalMin("-20") @DecimalMax("50") Double discountRate,
    Boolean fringeEnabled,
    @DecimalMin("0") @DecimalMax("100") Double fringeRate,
    Double pension,
    Double healthWelfare,
    Double annuity,
    Double clothingAllowance,
    Double otherBenefits,
    @DecimalMin("0") @DecimalMax("100") Double unemploymentRate,
    @DecimalMin("0") @DecimalMax("100") Double uiReplacementRate,
    @DecimalMin("0") @DecimalMax("100") Double fedTaxRate,
    @DecimalMin("0") @DecimalMax("100") Double stateTaxRate,
    CaseType caseType,
    @DecimalMin("0") @DecimalMax("100") Double personalConsumptionEra1,
    @DecimalMin("0") @DecimalMax("100") Double personalConsumptionEra2,
    @Min(1900) @Max(2200) Integer eraSplitYear,
    @DecimalMin("-20") @DecimalMax("50") Double era1WageGrowth,
    @DecimalMin("-20") @DecimalMax("50") Double era2WageGrowth,
    Boolean presentValue,
    @DecimalMin("0") @DecimalMax("120") Double pjiAge) {}
