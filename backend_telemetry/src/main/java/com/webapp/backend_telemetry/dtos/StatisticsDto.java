package com.webapp.backend_telemetry.dtos;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StatisticsDto {
    private long totalRuns;
    @Builder.Default
    private Map<String, ProfileStatsDto> byProfile = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Long> byExitReason = new LinkedHashMap<>();
    private long syscallViolations;
    private long avgRuntimeMs;
    private long avgCpuPercent;
    private long avgMemoryKb;
    @Builder.Default
    private Map<String, Long> syscallFrequency = new LinkedHashMap<>();

    public static StatisticsDto empty() {
        return StatisticsDto.builder().build();
    }
}
