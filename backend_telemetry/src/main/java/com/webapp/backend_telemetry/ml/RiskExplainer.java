package com.webapp.backend_telemetry.ml;

import com.webapp.backend_telemetry.dtos.FeatureRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Threshold rules that justify a verdict independently of the forest.
 * The label is accepted but never consulted: a Benign run may still list
 * "High CPU", and callers show both.
 */
public final class RiskExplainer {
    static final double HIGH_CPU_PERCENT = 80;
    static final double HIGH_MEMORY_KB = 100_000;
    static final double HIGH_MINOR_FAULTS = 1_000;

    public static final String NORMAL = "Normal behavior";

    private RiskExplainer() {
    }

    public static String explain(RiskLabel label, FeatureRow row) {
        List<String> reasons = new ArrayList<>();
        if (row.getPeakCpu() > HIGH_CPU_PERCENT) reasons.add("High CPU");
        if (row.getPeakMemoryKb() > HIGH_MEMORY_KB) reasons.add("High Memory");
        if (row.getPageFaultsMinor() > HIGH_MINOR_FAULTS) reasons.add("High Activity");
        if (row.getExitReason() != null && row.getExitReason().contains("VIOLATION")) {
            reasons.add("Syscall Violation");
        }

        if (reasons.isEmpty()) return NORMAL;
        return String.join(" + ", reasons);
    }
}
