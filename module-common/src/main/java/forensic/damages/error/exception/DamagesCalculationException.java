package forensic.damages.error.exception;

import forensic.damages.error.CommonErrorCode;
import forensic.damages.error.exception.base.ServerBaseException;

public class DamagesCalculationException extends ServerBaseException {
  public DamagesCalculationException(String caseReference, Throwable cause) {
    super(CommonErrorCode.CALCULATION_FAILURE, cause, caseReference);
  }
}
