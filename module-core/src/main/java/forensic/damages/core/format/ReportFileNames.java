package forensic.damages.core.format;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Export file naming: {@code <type>_<plaintiff>_<yyyy-MM-dd>[_<scenario>][.<ext>]}.
 *
 * <p>Non-alphanumeric characters in the plaintiff name become {@code -}; whitespace is removed from
 * the scenario label.
 */
public final class ReportFileNames {

  private static final String FALLBACK_NAME = "Report";

  private ReportFileNames() {
    throw new UnsupportedOperationException("Utility class");
  }

  public static String format(
      String reportType, String plaintiffName, String scenario, String extension, LocalDate date) {
    String name = plaintiffName == null || plaintiffName.isEmpty() ? FALLBACK_NAME : plaintiffName;
    String safeName = name.replaceAll("[^a-zA-Z0-9]", "-");
    String scenarioPart =
        scenario == null || scenario.isEmpty() ? "" : "_" + scenario.replaceAll("\\s+", "");
    String ext = extension == null || extension.isEmpty() ? "" : "." + extension;
    return reportType
        + "_"
        + safeName
        + "_"
        + date.format(DateTimeFormatter.ISO_LOCAL_DATE)
        + scenarioPart
        + ext;
  }
}
