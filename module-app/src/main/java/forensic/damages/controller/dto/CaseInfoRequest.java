package forensic.damages.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;

/**
 * Dates arrive as entered, {@code M/D/YYYY} or ISO. Blank dates are allowed and produce zeroed
 * date calculations.
 */
public record CaseInfoRequest(
    @Size(max = 200) String plaintiff,
    @Size(max = 100) String fileNumber,
    @Size(max = 200) String attorney,
    @Size(max = 200) String lawFirm,
    @Size(max = 20) String gender,
    String dateOfBirth,
    String dateOfInjury,
    String dateOfTrial,
    @DecimalMin("0") @DecimalMax("120") Double retirementAge,
    @DecimalMin("0") @DecimalMax("120") Double lifeExpectancy,
    @Size(max = 100) String jurisdiction) {}
