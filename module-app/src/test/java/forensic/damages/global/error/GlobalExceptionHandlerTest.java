package forensic.damages.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import forensic.damages.error.dto.ErrorResponse;
import forensic.damages.error.exception.InvalidDamagesInputException;
import forensic.damages.error.exception.ScenarioNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

  private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

  @Test
  @DisplayName("business exception keeps its status and formatted message")
  void businessException() {
    ResponseEntity<ErrorResponse> response =
        handler.handleBaseException(new ScenarioNotFoundException("pji"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().code()).isEqualTo("C002");
    assertThat(response.getBody().message()).contains("pji");
  }

  @Test
  @DisplayName("invalid input maps to 400 C001")
  void invalidInput() {
    ResponseEntity<ErrorResponse> response =
        handler.handleBaseException(new InvalidDamagesInputException("dateOfBirth 'x'"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().message()).isEqualTo("Invalid input value: dateOfBirth 'x'");
  }

  @Test
  @DisplayName("unexpected exception hides its message")
  void unexpected() {
    ResponseEntity<ErrorResponse> response =
        handler.handleException(new NullPointerException("internal state"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo("S001");
    assertThat(response.getBody().message()).doesNotContain("internal state");
    assertThat(response.getBody().details()).isEmpty();
  }
}
