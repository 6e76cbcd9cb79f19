package com.webapp.backend_telemetry.dtos;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * One telemetry document as written by the sandbox runner.
 * <p>
 * Older runners write the metrics flat at the top level; newer ones nest them
 * under {@code summary}. The inherited fields hold the top-level values.
 */
@Data
@NoArgsConstructor
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RawRecord extends RunSummary {
    @JsonDeserialize(using = LenientDeserializers.LenientString.class)
    private String profile;

    @JsonDeserialize(using = LenientDeserializers.LenientString.class)
    private String program;

    @JsonDeserialize(using = LenientDeserializers.LenientSummary.class)
    private RunSummary summary;

    @JsonDeserialize(using = LenientDeserializers.LenientTimeline.class)
    private Timeline timeline;
}
