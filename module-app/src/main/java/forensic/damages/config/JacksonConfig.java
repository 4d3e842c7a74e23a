package forensic.damages.config;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.StreamReadConstraints;
import forensic.damages.core.domain.model.LcpFrequency;
import forensic.damages.core.domain.model.ManualActuals;
import java.util.Map;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * JSON shape of engine types that are not plain records, plus request parsing limits.
 *
 * <p>The engine module stays free of Jackson annotations; mix-ins attach them here.
 */
@Configuration
public class JacksonConfig {

  private static final int MAX_DEPTH = 50;
  private static final int MAX_STRING_LENGTH = 100_000;
  private static final int MAX_NAME_LENGTH = 256;

  @Bean
  public Jackson2ObjectMapperBuilderCustomizer damagesJsonCustomizer() {
    return builder ->
        builder
            .mixIn(ManualActuals.class, ManualActualsMixIn.class)
            .mixIn(LcpFrequency.class, LcpFrequencyMixIn.class)
            .postConfigurer(
                objectMapper ->
                    objectMapper
                        .getFactory()
                        .setStreamReadConstraints(
                            StreamReadConstraints.builder()
                                .maxNestingDepth(MAX_DEPTH)
                                .maxStringLength(MAX_STRING_LENGTH)
                                .maxNameLength(MAX_NAME_LENGTH)
                                .build()));
  }

  /** Manual actuals serialize as their {@code year → amount} map. */
  abstract static class ManualActualsMixIn {
    @JsonValue
    abstract Map<Integer, String> entries();
  }

  /** Frequency variants carry a {@code mode} discriminator. */
  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "mode")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = LcpFrequency.Annual.class, name = "annual"),
    @JsonSubTypes.Type(value = LcpFrequency.OneTime.class, name = "onetime"),
    @JsonSubTypes.Type(value = LcpFrequency.Recurring.class, name = "recurring"),
    @JsonSubTypes.Type(value = LcpFrequency.CustomYears.class, name = "custom")
  })
  abstract static class LcpFrequencyMixIn {}
}
