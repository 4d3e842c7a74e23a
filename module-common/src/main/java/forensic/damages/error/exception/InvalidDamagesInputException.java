package forensic.damages.error.exception;

import forensic.damages.error.CommonErrorCode;
import forensic.damages.error.exception.base.ClientBaseException;

public class InvalidDamagesInputException extends ClientBaseException {
  public InvalidDamagesInputException(String detail) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }
}
