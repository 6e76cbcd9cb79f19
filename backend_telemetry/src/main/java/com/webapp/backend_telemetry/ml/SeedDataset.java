package com.webapp.backend_telemetry.ml;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Hand-labelled archetypes that keep the decision boundary meaningful before
 * any real runs have been collected.
 */
public final class SeedDataset {

    @Getter
    @AllArgsConstructor
    public static class Sample {
        private final String archetype;
        private final double[] features;
        private final RiskLabel label;
    }

    // runtime_ms, cpu_usage_percent, memory_peak_kb, page_faults_minor, page_faults_major
    public static final List<Sample> SAMPLES = List.of(
            new Sample("trivial", new double[]{10, 5, 200, 10, 0}, RiskLabel.BENIGN),
            new Sample("normal-calc", new double[]{50, 10, 1024, 50, 0}, RiskLabel.BENIGN),
            new Sample("cpu-hog", new double[]{5000, 99, 1024, 100, 0}, RiskLabel.MALICIOUS),
            new Sample("memory-eater", new double[]{100, 10, 512000, 5000, 10}, RiskLabel.MALICIOUS),
            new Sample("fork-bomb", new double[]{200, 30, 400, 10000, 0}, RiskLabel.MALICIOUS)
    );

    private SeedDataset() {
    }
}
