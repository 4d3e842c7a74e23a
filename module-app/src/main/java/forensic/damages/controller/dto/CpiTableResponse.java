package forensic.damages.controller.dto;

import forensic.damages.core.domain.cpi.CpiCategory;
import forensic.damages.core.domain.cpi.CpiCategoryTable;
import java.util.List;

public record CpiTableResponse(String version, List<CpiCategory> categories) {

  public static CpiTableResponse from(CpiCategoryTable table) {
    return new CpiTableResponse(table.version(), table.categories());
  }
}
