package forensic.damages.global.error;

import forensic.damages.error.CommonErrorCode;
import forensic.damages.error.dto.ErrorResponse;
import forensic.damages.error.exception.base.BaseException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** Business exceptions carry their own status and a formatted message. */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    log.warn(
        "[Error] Business exception. code={}, message={}",
        e.getErrorCode().getCode(),
        e.getMessage());
    return ErrorResponse.toResponseEntity(e);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  protected ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    List<String> details =
        e.getBindingResult().getFieldErrors().stream()
            .map(GlobalExceptionHandler::describe)
            .sorted()
            .toList();
    log.warn("[Error] Request validation failed. violations={}", details);
    return badRequest(
        String.format(CommonErrorCode.INVALID_INPUT_VALUE.getMessage(), "request"), details);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  protected ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
    log.warn("[Error] Unreadable request. reason={}", e.getMessage());
    return badRequest(
        String.format(CommonErrorCode.INVALID_INPUT_VALUE.getMessage(), "malformed request"),
        List.of());
  }

  /** Anything else is a system failure; details stay in the log. */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("[Error] Unexpected system failure", e);
    return ErrorResponse.toResponseEntity(CommonErrorCode.INTERNAL_SERVER_ERROR);
  }

  private static ResponseEntity<ErrorResponse> badRequest(String message, List<String> details) {
    CommonErrorCode code = CommonErrorCode.INVALID_INPUT_VALUE;
    return ResponseEntity.status(code.getStatus())
        .body(
            ErrorResponse.builder()
                .status(code.getStatusCode())
                .code(code.getCode())
                .message(message)
                .details(details)
                .build());
  }

  private static String describe(FieldError error) {
    return error.getField() + ": " + error.getDefaultMessage();
  }
}
