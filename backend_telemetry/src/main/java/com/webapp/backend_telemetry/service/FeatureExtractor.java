package com.webapp.backend_telemetry.service;

import com.webapp.backend_telemetry.dtos.ExitCategory;
import com.webapp.backend_telemetry.dtos.FeatureRow;
import com.webapp.backend_telemetry.dtos.LogEntry;
import com.webapp.backend_telemetry.dtos.RawRecord;
import com.webapp.backend_telemetry.dtos.RunSummary;
import com.webapp.backend_telemetry.dtos.Timeline;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Projects raw telemetry documents onto {@link FeatureRow}. Stateless: the
 * same input always yields the same rows, in the same order.
 */
@Service
public class FeatureExtractor {

    public List<FeatureRow> extract(List<LogEntry> entries) {
        if (entries == null || entries.isEmpty()) return Collections.emptyList();
        List<FeatureRow> rows = new ArrayList<>(entries.size());
        for (LogEntry entry : entries) {
            rows.add(extract(entry));
        }
        return rows;
    }

    public FeatureRow extract(LogEntry entry) {
        RawRecord record = entry.getRecord() == null ? new RawRecord() : entry.getRecord();
        String exitReason = text(record, RunSummary::getExitReason);
        Timeline timeline = record.getTimeline();

        return FeatureRow.builder()
                .source(entry.getSource())
                .timestamp(entry.getLastModified())
                .profile(record.getProfile())
                .program(record.getProgram())
                .exitReason(exitReason)
                .exitCategory(ExitCategory.of(exitReason))
                .blockedSyscall(text(record, RunSummary::getBlockedSyscall))
                .terminationSignal(text(record, RunSummary::getTerminationSignal))
                .runtimeMs(nonNegative(number(record, RunSummary::getRuntimeMs)))
                .peakCpu(Math.min(100.0, nonNegative(number(record, RunSummary::getPeakCpu))))
                .peakMemoryKb(nonNegative(number(record, RunSummary::getPeakMemoryKb)))
                .pageFaultsMinor(nonNegative(number(record, RunSummary::getPageFaultsMinor)))
                .pageFaultsMajor(nonNegative(number(record, RunSummary::getPageFaultsMajor)))
                .memGrowthRate(growthRate(timeline == null ? null : timeline.getMemoryKb()))
                .cpuVariance(variance(timeline == null ? null : timeline.getCpuPercent()))
                .build();
    }

    /**
     * Least-squares slope of the samples against their original index. Null or
     * non-finite samples are skipped without shifting the ones after them.
     * Zero when fewer than two usable samples remain or they are all equal.
     */
    static double growthRate(List<Double> samples) {
        double[] values = finite(samples);
        if (values.length < 2) return 0.0;
        if (new Variance(false).evaluate(values) == 0.0) return 0.0;

        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < samples.size(); i++) {
            Double sample = samples.get(i);
            if (sample != null && Double.isFinite(sample)) {
                regression.addData(i, sample);
            }
        }
        double slope = regression.getSlope();
        return Double.isFinite(slope) ? slope : 0.0;
    }

    static double variance(List<Double> samples) {
        double[] values = finite(samples);
        if (values.length < 2) return 0.0;
        return new Variance(false).evaluate(values);
    }

    // summary wins over the top level
    private static Double number(RawRecord record, Function<RunSummary, Double> field) {
        RunSummary summary = record.getSummary();
        if (summary != null && field.apply(summary) != null) return field.apply(summary);
        return field.apply(record);
    }

    private static String text(RawRecord record, Function<RunSummary, String> field) {
        RunSummary summary = record.getSummary();
        if (summary != null && field.apply(summary) != null) return field.apply(summary);
        return field.apply(record);
    }

    private static double nonNegative(Double value) {
        if (value == null || !Double.isFinite(value) || value < 0) return 0.0;
        return value;
    }

    private static double[] finite(List<Double> samples) {
        if (samples == null) return new double[0];
        return samples.stream()
                .filter(Objects::nonNull)
                .filter(Double::isFinite)
                .mapToDouble(Double::doubleValue)
                .toArray();
    }
}
