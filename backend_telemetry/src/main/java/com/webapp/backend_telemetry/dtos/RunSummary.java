package com.webapp.backend_telemetry.dtos;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Metrics reported by the sandbox monitor for one execution.
 * <p>
 * Every field is optional. A {@code null} means the monitor did not report it;
 * {@link com.webapp.backend_telemetry.service.FeatureExtractor} resolves it to zero.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunSummary {
    @JsonDeserialize(using = LenientDeserializers.LenientDouble.class)
    private Double runtimeMs;

    @JsonAlias("cpu_usage_percent")
    @JsonDeserialize(using = LenientDeserializers.LenientDouble.class)
    private Double peakCpu;

    @JsonAlias("memory_peak_kb")
    @JsonDeserialize(using = LenientDeserializers.LenientDouble.class)
    private Double peakMemoryKb;

    @JsonDeserialize(using = LenientDeserializers.LenientDouble.class)
    private Double pageFaultsMinor;

    @JsonDeserialize(using = LenientDeserializers.LenientDouble.class)
    private Double pageFaultsMajor;

    @JsonDeserialize(using = LenientDeserializers.LenientString.class)
    private String exitReason;

    @JsonDeserialize(using = LenientDeserializers.LenientString.class)
    private String blockedSyscall;

    @JsonDeserialize(using = LenientDeserializers.LenientString.class)
    private String terminationSignal;
}
