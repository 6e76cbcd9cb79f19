package com.webapp.backend_telemetry.service;

import com.webapp.backend_telemetry.dtos.FeatureRow;
import com.webapp.backend_telemetry.dtos.ProfileStatsDto;
import com.webapp.backend_telemetry.dtos.StatisticsDto;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsEngineTest {

    private final StatisticsEngine engine = new StatisticsEngine();

    private static FeatureRow row(String profile, String exitReason, double runtime, double cpu, double mem, String syscall) {
        return FeatureRow.builder()
                .profile(profile)
                .exitReason(exitReason)
                .runtimeMs(runtime)
                .peakCpu(cpu)
                .peakMemoryKb(mem)
                .blockedSyscall(syscall)
                .build();
    }

    @Test
    void emptyInputYieldsZeroResult() {
        StatisticsDto stats = engine.aggregate(List.of());

        assertEquals(0, stats.getTotalRuns());
        assertTrue(stats.getByProfile().isEmpty());
        assertTrue(stats.getByExitReason().isEmpty());
        assertTrue(stats.getSyscallFrequency().isEmpty());
        assertEquals(0, stats.getSyscallViolations());
        assertEquals(0, stats.getAvgRuntimeMs());
        assertEquals(0, stats.getAvgCpuPercent());
        assertEquals(0, stats.getAvgMemoryKb());
    }

    @Test
    void nullInputYieldsZeroResult() {
        assertEquals(0, engine.aggregate(null).getTotalRuns());
    }

    @Test
    void singleRunScenario() {
        StatisticsDto stats = engine.aggregate(List.of(row("strict", "EXITED(0)", 10, 5, 200, null)));

        assertEquals(1, stats.getTotalRuns());
        assertEquals(5, stats.getAvgCpuPercent());
        assertEquals(10, stats.getAvgRuntimeMs());
        assertEquals(200, stats.getAvgMemoryKb());
        assertEquals(Map.of("EXITED(0)", 1L), stats.getByExitReason());
        assertEquals(0, stats.getSyscallViolations());
    }

    @Test
    void groupsByProfileAndExitReason() {
        StatisticsDto stats = engine.aggregate(List.of(
                row("strict", "EXITED(0)", 10, 10, 100, null),
                row("strict", "VIOLATION:execve", 20, 95, 300, "execve"),
                row("relaxed", "SIGNALED(9)", 30, 50, 1000, ""),
                row(null, null, 40, 1, 2, null)));

        assertEquals(4, stats.getTotalRuns());

        ProfileStatsDto strict = stats.getByProfile().get("strict");
        assertEquals(2, strict.getCount());
        assertEquals(52, strict.getAvgCpu());
        assertEquals(200, strict.getAvgMem());
        assertEquals(1, stats.getByProfile().get("relaxed").getCount());
        assertEquals(1, stats.getByProfile().get("UNKNOWN").getCount());

        assertEquals(1L, stats.getByExitReason().get("VIOLATION:execve"));
        assertEquals(1L, stats.getByExitReason().get("UNKNOWN"));
        assertEquals(1, stats.getSyscallViolations());

        assertEquals(25, stats.getAvgRuntimeMs());
        assertEquals(39, stats.getAvgCpuPercent());
        assertEquals(350, stats.getAvgMemoryKb());
    }

    @Test
    void syscallFrequencyCountsOnlyNonEmptyNames() {
        Map<String, Long> frequency = engine.syscallFrequency(List.of(
                row("p", "VIOLATION:execve", 0, 0, 0, "execve"),
                row("p", "VIOLATION:execve", 0, 0, 0, "execve"),
                row("p", "VIOLATION:socket", 0, 0, 0, "socket"),
                row("p", "EXITED(0)", 0, 0, 0, ""),
                row("p", "EXITED(0)", 0, 0, 0, null)));

        assertEquals(Map.of("execve", 2L, "socket", 1L), frequency);
    }

    @Test
    void violationCountIncrementsPerViolatingRun() {
        long before = engine.aggregate(List.of(row("p", "EXITED(0)", 1, 1, 1, null))).getSyscallViolations();
        long after = engine.aggregate(List.of(
                row("p", "EXITED(0)", 1, 1, 1, null),
                row("p", "VIOLATION:execve", 1, 95, 1, "execve"))).getSyscallViolations();

        assertEquals(before + 1, after);
    }
}
