package com.webapp.backend_telemetry.dtos;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dashboard landing payload: headline numbers plus the most recent runs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OverviewDto {
    private long totalRuns;
    private long avgCpu;
    private long avgMem;
    @Builder.Default
    private Map<String, Long> violations = new LinkedHashMap<>();
    @Builder.Default
    private List<EnrichedRun> runs = new ArrayList<>();

    public static OverviewDto empty() {
        return OverviewDto.builder().build();
    }
}
