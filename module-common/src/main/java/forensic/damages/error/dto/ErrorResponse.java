package forensic.damages.error.dto;

import forensic.damages.error.ErrorCode;
import forensic.damages.error.exception.base.BaseException;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.http.ResponseEntity;

public record ErrorResponse(
    int status, String code, String message, List<String> details, LocalDateTime timestamp) {

  public ErrorResponse {
    details = details == null ? List.of() : List.copyOf(details);
  }

  public static ErrorResponseBuilder builder() {
    return new ErrorResponseBuilder();
  }

  public static class ErrorResponseBuilder {
    private Integer status;
    private String code;
    private String message;
    private List<String> details;
    private LocalDateTime timestamp;

    public ErrorResponseBuilder status(int status) {
      this.status = status;
      return this;
    }

    public ErrorResponseBuilder code(String code) {
      this.code = code;
      return this;
    }

    public ErrorResponseBuilder message(String message) {
      this.message = message;
      return this;
    }

    public ErrorResponseBuilder details(List<String> details) {
      this.details = details;
      return this;
    }

    public ErrorResponseBuilder timestamp(LocalDateTime timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public ErrorResponse build() {
      return new ErrorResponse(
          status != null ? status : 500,
          code != null ? code : "S001",
          message != null ? message : "Unknown error",
          details,
          timestamp != null ? timestamp : LocalDateTime.now());
    }
  }

  /**
   * Business exception: the formatted message (e.g. which scenario id was unknown) goes back to the
   * caller.
   */
  public static ErrorResponse from(BaseException e) {
    return ErrorResponse.builder()
        .status(e.getErrorCode().getStatusCode())
        .code(e.getErrorCode().getCode())
        .message(e.getMessage())
        .build();
  }

  /** System failure: only the static catalogue message is exposed. */
  public static ErrorResponse from(ErrorCode errorCode) {
    return ErrorResponse.builder()
        .status(errorCode.getStatusCode())
        .code(errorCode.getCode())
        .message(errorCode.getMessage())
        .build();
  }

  public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
    return ResponseEntity.status(e.getErrorCode().getStatus()).body(from(e));
  }

  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
    return ResponseEntity.status(errorCode.getStatus()).body(from(errorCode));
  }
}
