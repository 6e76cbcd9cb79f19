package com.webapp.backend_telemetry.dtos;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunsReport {
    private long totalRuns;
    private long unenrichedRuns;
    @Builder.Default
    private List<EnrichedRun> runs = new ArrayList<>();

    public static RunsReport empty() {
        return RunsReport.builder().build();
    }
}
