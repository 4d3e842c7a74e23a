package forensic.damages.error.exception;

import forensic.damages.error.CommonErrorCode;
import forensic.damages.error.exception.base.ClientBaseException;

public class UnknownCpiCategoryException extends ClientBaseException {
  public UnknownCpiCategoryException(String categoryId) {
    super(CommonErrorCode.UNKNOWN_CPI_CATEGORY, categoryId);
  }
}
