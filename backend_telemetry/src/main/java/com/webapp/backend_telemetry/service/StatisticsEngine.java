package com.webapp.backend_telemetry.service;

import com.webapp.backend_telemetry.dtos.FeatureRow;
import com.webapp.backend_telemetry.dtos.ProfileStatsDto;
import com.webapp.backend_telemetry.dtos.StatisticsDto;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

@Service
public class StatisticsEngine {
    static final String UNKNOWN = "UNKNOWN";

    public StatisticsDto aggregate(List<FeatureRow> rows) {
        if (rows == null || rows.isEmpty()) return StatisticsDto.empty();

        Map<String, List<FeatureRow>> byProfile = new LinkedHashMap<>();
        Map<String, Long> byExitReason = new LinkedHashMap<>();
        long violations = 0;

        for (FeatureRow row : rows) {
            byProfile.computeIfAbsent(orUnknown(row.getProfile()), k -> new ArrayList<>()).add(row);
            String exitReason = orUnknown(row.getExitReason());
            byExitReason.merge(exitReason, 1L, Long::sum);
            if (exitReason.contains("VIOLATION")) violations++;
        }

        Map<String, ProfileStatsDto> profiles = new LinkedHashMap<>();
        byProfile.forEach((profile, group) -> profiles.put(profile, ProfileStatsDto.builder()
                .count(group.size())
                .avgCpu(mean(group, FeatureRow::getPeakCpu))
                .avgMem(mean(group, FeatureRow::getPeakMemoryKb))
                .build()));

        return StatisticsDto.builder()
                .totalRuns(rows.size())
                .byProfile(profiles)
                .byExitReason(byExitReason)
                .syscallViolations(violations)
                .avgRuntimeMs(mean(rows, FeatureRow::getRuntimeMs))
                .avgCpuPercent(mean(rows, FeatureRow::getPeakCpu))
                .avgMemoryKb(mean(rows, FeatureRow::getPeakMemoryKb))
                .syscallFrequency(syscallFrequency(rows))
                .build();
    }

    /**
     * Blocked syscall name to number of runs that tripped it.
     */
    public Map<String, Long> syscallFrequency(List<FeatureRow> rows) {
        Map<String, Long> counts = new LinkedHashMap<>();
        if (rows == null) return counts;
        for (FeatureRow row : rows) {
            String syscall = row.getBlockedSyscall();
            if (syscall != null && !syscall.isBlank()) {
                counts.merge(syscall, 1L, Long::sum);
            }
        }
        return counts;
    }

    // truncated toward zero
    private static long mean(List<FeatureRow> rows, ToDoubleFunction<FeatureRow> field) {
        if (rows.isEmpty()) return 0;
        double[] values = rows.stream().mapToDouble(field).toArray();
        return (long) new Mean().evaluate(values);
    }

    private static String orUnknown(String value) {
        return value == null || value.isEmpty() ? UNKNOWN : value;
    }
}
