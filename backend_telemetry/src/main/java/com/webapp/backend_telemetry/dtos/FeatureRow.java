package com.webapp.backend_telemetry.dtos;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Fixed-schema projection of a {@link RawRecord}.
 * <p>
 * Runtime, memory and fault counts are finite and non-negative, {@code peakCpu}
 * lies in [0, 100] and {@code memGrowthRate} is any finite value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FeatureRow {
    private String source;
    private Instant timestamp;
    private String profile;
    private String program;
    private String exitReason;
    private ExitCategory exitCategory;
    private String blockedSyscall;
    private String terminationSignal;

    private double runtimeMs;
    private double peakCpu;
    private double peakMemoryKb;
    private double pageFaultsMinor;
    private double pageFaultsMajor;
    private double memGrowthRate;
    private double cpuVariance;
}
