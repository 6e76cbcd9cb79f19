package com.webapp.backend_telemetry.service;

import com.webapp.backend_telemetry.config.TelemetryProperties;
import com.webapp.backend_telemetry.dtos.EnrichedRun;
import com.webapp.backend_telemetry.dtos.FeatureRow;
import com.webapp.backend_telemetry.dtos.ModelInfoDto;
import com.webapp.backend_telemetry.dtos.OverviewDto;
import com.webapp.backend_telemetry.dtos.RunsReport;
import com.webapp.backend_telemetry.dtos.StatisticsDto;
import com.webapp.backend_telemetry.ml.RiskClassifier;
import com.webapp.backend_telemetry.ml.RiskModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the dashboard payloads from one cache epoch. Nothing thrown below
 * this class reaches the caller: a failure degrades to the empty payload.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsService {
    private final FeatureCache featureCache;
    private final StatisticsEngine statisticsEngine;
    private final RiskClassifier riskClassifier;
    private final TelemetryProperties properties;

    public StatisticsDto getStatistics() {
        try {
            return statisticsEngine.aggregate(featureCache.getFeatures().getFeatureTable());
        } catch (RuntimeException e) {
            log.error("Failed to compute statistics", e);
            return StatisticsDto.empty();
        }
    }

    public RunsReport getRuns() {
        try {
            FeatureCache.CacheEntry entry = featureCache.getFeatures();
            return enrich(entry.getFeatureTable(), entry.getModel());
        } catch (RuntimeException e) {
            log.error("Failed to build run table", e);
            return RunsReport.empty();
        }
    }

    public ModelInfoDto getModelInfo() {
        try {
            return riskClassifier.modelInfo(featureCache.getFeatures().getModel());
        } catch (RuntimeException e) {
            log.error("Failed to describe model", e);
            return ModelInfoDto.builder()
                    .modelType(RiskClassifier.MODEL_TYPE)
                    .features(RiskModel.FEATURE_NAMES)
                    .trained(false)
                    .build();
        }
    }

    public OverviewDto getOverview() {
        try {
            FeatureCache.CacheEntry entry = featureCache.getFeatures();
            StatisticsDto stats = statisticsEngine.aggregate(entry.getFeatureTable());
            RunsReport runs = enrich(entry.getFeatureTable(), entry.getModel());
            return OverviewDto.builder()
                    .totalRuns(stats.getTotalRuns())
                    .avgCpu(stats.getAvgCpuPercent())
                    .avgMem(stats.getAvgMemoryKb())
                    .violations(stats.getByExitReason())
                    .runs(runs.getRuns())
                    .build();
        } catch (RuntimeException e) {
            log.error("Failed to build overview", e);
            return OverviewDto.empty();
        }
    }

    public StatisticsDto refresh() {
        featureCache.invalidate();
        return getStatistics();
    }

    private RunsReport enrich(List<FeatureRow> table, RiskModel model) {
        int limit = properties.getDashboard().getMaxRuns();
        List<FeatureRow> shown = limit > 0 && table.size() > limit ? table.subList(0, limit) : table;

        List<EnrichedRun> runs = new ArrayList<>(shown.size());
        long unenriched = 0;
        for (FeatureRow row : shown) {
            EnrichedRun run = EnrichedRun.builder()
                    .features(row)
                    .risk(riskClassifier.tryPredict(model, row).orElse(null))
                    .build();
            if (!run.isEnriched()) unenriched++;
            runs.add(run);
        }
        return RunsReport.builder()
                .totalRuns(table.size())
                .unenrichedRuns(unenriched)
                .runs(runs)
                .build();
    }
}
