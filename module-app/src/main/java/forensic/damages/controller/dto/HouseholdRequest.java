package forensic.damages.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;

public record HouseholdRequest(
    boolean active,
    @DecimalMin("0") @DecimalMax("168") Double hoursPerWeek,
    @PositiveOrZero Double hourlyRate,
    @DecimalMin("-20") @DecimalMax("50") Double growthRate,
    @DecimalMin("-20") @DecimalMax("50") Double discountRate) {}
