package com.webapp.backend_telemetry.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webapp.backend_telemetry.config.TelemetryProperties;
import com.webapp.backend_telemetry.dtos.EnrichedRun;
import com.webapp.backend_telemetry.dtos.FeatureRow;
import com.webapp.backend_telemetry.dtos.ModelInfoDto;
import com.webapp.backend_telemetry.dtos.OverviewDto;
import com.webapp.backend_telemetry.dtos.RunsReport;
import com.webapp.backend_telemetry.dtos.StatisticsDto;
import com.webapp.backend_telemetry.ml.RiskClassifier;
import com.webapp.backend_telemetry.repository.TelemetryLogStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnalyticsServiceTest {

    @TempDir
    Path logDir;

    private TelemetryProperties properties;
    private RiskClassifier classifier;
    private AnalyticsService service;

    @BeforeEach
    void setUp() {
        properties = new TelemetryProperties();
        properties.setLogDir(logDir.toString());
        classifier = new RiskClassifier(properties);
        FeatureCache cache = new FeatureCache(
                new TelemetryLogStore(new ObjectMapper(), properties), new FeatureExtractor(), classifier);
        service = new AnalyticsService(cache, new StatisticsEngine(), classifier, properties);
    }

    @Test
    void quietStrictRunScenario() throws IOException {
        Files.writeString(logDir.resolve("ls.json"), """
            {"profile": "strict",
             "summary": {"runtime_ms": 10, "peak_cpu": 5, "peak_memory_kb": 200,
                         "page_faults_minor": 10, "page_faults_major": 0, "exit_reason": "EXITED(0)"}}
            """);

        StatisticsDto stats = service.getStatistics();
        RunsReport runs = service.getRuns();

        assertEquals(1, stats.getTotalRuns());
        assertEquals(5, stats.getAvgCpuPercent());
        assertEquals(1, runs.getRuns().size());
        assertEquals("Normal behavior", runs.getRuns().get(0).getRisk().getReason());
    }

    @Test
    void violatingRunScenario() throws IOException {
        Files.writeString(logDir.resolve("exec.json"), """
            {"profile": "strict",
             "summary": {"runtime_ms": 40, "peak_cpu": 95, "peak_memory_kb": 300,
                         "exit_reason": "VIOLATION:execve", "blocked_syscall": "execve"}}
            """);

        StatisticsDto stats = service.getStatistics();
        String reason = service.getRuns().getRuns().get(0).getRisk().getReason();

        assertTrue(reason.contains("High CPU"));
        assertTrue(reason.contains("Syscall Violation"));
        assertEquals(1, stats.getSyscallViolations());
        assertEquals(Map.of("execve", 1L), stats.getSyscallFrequency());
    }

    @Test
    void runWithOneBadFieldIsStillCounted() throws IOException {
        Files.writeString(logDir.resolve("ok.json"), "{\"summary\": {\"exit_reason\": \"EXITED(0)\"}}");
        Files.writeString(logDir.resolve("exec.json"), """
            {"profile": "strict",
             "summary": {"peak_cpu": 95, "peak_memory_kb": "n/a",
                         "exit_reason": "VIOLATION:execve", "blocked_syscall": "execve"},
             "timeline": []}
            """);

        StatisticsDto stats = service.getStatistics();
        RunsReport runs = service.getRuns();

        assertEquals(2, stats.getTotalRuns());
        assertEquals(1, stats.getSyscallViolations());
        assertEquals(Map.of("execve", 1L), stats.getSyscallFrequency());
        assertEquals(2, runs.getRuns().size());
        FeatureRow exec = runs.getRuns().stream()
                .map(EnrichedRun::getFeatures)
                .filter(row -> "strict".equals(row.getProfile()))
                .findFirst().orElseThrow();
        assertEquals(0.0, exec.getPeakMemoryKb());
        assertEquals(0.0, exec.getMemGrowthRate());
    }

    @Test
    void emptyDirectoryStillYieldsCompletePayloads() {
        assertEquals(0, service.getStatistics().getTotalRuns());
        assertTrue(service.getRuns().getRuns().isEmpty());
        assertTrue(service.getModelInfo().isTrained());
        assertEquals(0, service.getOverview().getTotalRuns());
    }

    @Test
    void runTableIsCapped() throws IOException {
        properties.getDashboard().setMaxRuns(2);
        for (int i = 0; i < 3; i++) {
            Files.writeString(logDir.resolve("run" + i + ".json"), "{\"summary\": {\"exit_reason\": \"EXITED(0)\"}}");
        }

        RunsReport report = service.getRuns();

        assertEquals(3, report.getTotalRuns());
        assertEquals(2, report.getRuns().size());
    }

    @Test
    void overviewMirrorsStatistics() throws IOException {
        Files.writeString(logDir.resolve("a.json"), "{\"summary\": {\"peak_cpu\": 20, \"peak_memory_kb\": 100, \"exit_reason\": \"EXITED(0)\"}}");
        Files.writeString(logDir.resolve("b.json"), "{\"summary\": {\"peak_cpu\": 40, \"peak_memory_kb\": 300, \"exit_reason\": \"SIGNALED(9)\"}}");

        OverviewDto overview = service.getOverview();

        assertEquals(2, overview.getTotalRuns());
        assertEquals(30, overview.getAvgCpu());
        assertEquals(200, overview.getAvgMem());
        assertEquals(Map.of("EXITED(0)", 1L, "SIGNALED(9)", 1L), overview.getViolations());
        assertEquals(2, overview.getRuns().size());
    }

    @Test
    void failedPredictionKeepsRowWithoutEnrichment() {
        FeatureCache cache = mock(FeatureCache.class);
        FeatureRow good = FeatureRow.builder().source("good").runtimeMs(10).peakCpu(5).exitReason("EXITED(0)").build();
        FeatureRow broken = FeatureRow.builder().source("broken").runtimeMs(Double.POSITIVE_INFINITY).build();
        when(cache.getFeatures()).thenReturn(new FeatureCache.CacheEntry(List.of(good, broken), 2, classifier.getModel()));
        AnalyticsService isolated = new AnalyticsService(cache, new StatisticsEngine(), classifier, properties);

        RunsReport report = isolated.getRuns();

        assertEquals(2, report.getRuns().size());
        assertEquals(1, report.getUnenrichedRuns());
        EnrichedRun failed = report.getRuns().get(1);
        assertEquals("broken", failed.getFeatures().getSource());
        assertFalse(failed.isEnriched());
        assertTrue(report.getRuns().get(0).isEnriched());
    }

    @Test
    void pipelineFailureDegradesToEmptyPayloads() {
        FeatureCache cache = mock(FeatureCache.class);
        when(cache.getFeatures()).thenThrow(new IllegalStateException("disk on fire"));
        AnalyticsService failing = new AnalyticsService(cache, new StatisticsEngine(), classifier, properties);

        StatisticsDto stats = failing.getStatistics();
        assertEquals(0, stats.getTotalRuns());
        assertNotNull(stats.getByProfile());
        assertNotNull(stats.getSyscallFrequency());

        assertTrue(failing.getRuns().getRuns().isEmpty());
        assertTrue(failing.getOverview().getRuns().isEmpty());

        ModelInfoDto info = failing.getModelInfo();
        assertFalse(info.isTrained());
        assertEquals(5, info.getFeatures().size());
    }
}
