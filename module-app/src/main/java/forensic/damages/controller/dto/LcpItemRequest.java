package forensic.damages.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

/**
 * Life-care-plan item in its authoring form.
 *
 * @param freqType {@code annual}, {@code onetime} or {@code recurring}
 * @param duration years the item runs for; the later of this and {@code endYear} wins
 * @param useCustomYears when set, {@code customYears} replaces the range entirely
 */
public record LcpItemRequest(
    Long id,
    @NotBlank String name,
    String categoryId,
    @PositiveOrZero double baseCost,
    @DecimalMin("-20") @DecimalMax("50") Double cpiOverride,
    String freqType,
    Integer startYear,
    Integer endYear,
    @PositiveOrZero Integer duration,
    @Min(1) Integer recurrenceInterval,
    boolean useCustomYears,
    List<@Min(1) Integer> customYears) {}
