package forensic.damages.core.report;

import java.time.Instant;
import java.util.List;

/**
 * Provenance of a report snapshot.
 *
 * @param reportId unique id of this snapshot
 * @param generatedAt creation instant
 * @param appVersion version of the producing service
 * @param schemaVersion version of the snapshot layout
 * @param calculationMethod always {@link #TINARI_ALGEBRAIC}
 * @param activeScenario scenario highlighted by the economist, nullable
 * @param includedScenarios ids of scenarios shown in the report, in display order
 */
public record ReportMetadata(
    String reportId,
    Instant generatedAt,
    String appVersion,
    String schemaVersion,
    String calculationMethod,
    String activeScenario,
    List<String> includedScenarios) {

  public static final String TINARI_ALGEBRAIC = "tinari-algebraic";

  public ReportMetadata {
    includedScenarios = List.copyOf(includedScenarios);
  }
}
