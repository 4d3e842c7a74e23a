package forensic.damages.global.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for successful damages responses. Failures are rendered by the exception handler as
 * {@link forensic.damages.error.dto.ErrorResponse} instead.
 *
 * @param success always true
 * @param data engine output
 * @param <T> payload type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data) {

  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(true, data);
  }
}
