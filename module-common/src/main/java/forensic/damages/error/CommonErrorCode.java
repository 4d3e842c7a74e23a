package forensic.damages.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "Invalid input value: %s", HttpStatus.BAD_REQUEST),
  UNKNOWN_SCENARIO("C002", "Unknown retirement scenario (id: %s)", HttpStatus.NOT_FOUND),
  UNKNOWN_CPI_CATEGORY("C003", "Unknown CPI category (id: %s)", HttpStatus.NOT_FOUND),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR(
      "S001", "An internal server error occurred.", HttpStatus.INTERNAL_SERVER_ERROR),
  CALCULATION_FAILURE(
      "S002", "Damages calculation failed (case: %s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
