package forensic.damages.error.exception.base;

import forensic.damages.error.ErrorCode;

/**
 * ClientBaseException: 4xx business errors caused by the request itself. The message is returned
 * to the caller as-is, so it should say exactly which input was rejected.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
