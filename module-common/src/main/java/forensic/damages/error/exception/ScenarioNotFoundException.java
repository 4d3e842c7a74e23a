package forensic.damages.error.exception;

import forensic.damages.error.CommonErrorCode;
import forensic.damages.error.exception.base.ClientBaseException;

public class ScenarioNotFoundException extends ClientBaseException {
  public ScenarioNotFoundException(String scenarioId) {
    super(CommonErrorCode.UNKNOWN_SCENARIO, scenarioId);
  }
}
