package com.webapp.backend_telemetry.ml;

import com.webapp.backend_telemetry.dtos.FeatureRow;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RiskExplainerTest {

    @Test
    void quietRunIsNormal() {
        FeatureRow row = FeatureRow.builder()
                .runtimeMs(10).peakCpu(5).peakMemoryKb(200).pageFaultsMinor(10)
                .exitReason("EXITED(0)")
                .build();

        assertEquals("Normal behavior", RiskExplainer.explain(RiskLabel.BENIGN, row));
    }

    @Test
    void reasonsAccumulateInFixedOrder() {
        FeatureRow row = FeatureRow.builder()
                .peakCpu(95).peakMemoryKb(200_000).pageFaultsMinor(5000)
                .exitReason("VIOLATION:execve")
                .build();

        assertEquals("High CPU + High Memory + High Activity + Syscall Violation",
                RiskExplainer.explain(RiskLabel.MALICIOUS, row));
    }

    @Test
    void thresholdsAreStrict() {
        FeatureRow row = FeatureRow.builder()
                .peakCpu(80).peakMemoryKb(100_000).pageFaultsMinor(1000)
                .build();

        assertEquals(RiskExplainer.NORMAL, RiskExplainer.explain(RiskLabel.BENIGN, row));
    }

    @Test
    void explanationIgnoresLabel() {
        FeatureRow row = FeatureRow.builder().peakCpu(99).exitReason("EXITED(0)").build();

        assertEquals("High CPU", RiskExplainer.explain(RiskLabel.BENIGN, row));
        assertEquals("High CPU", RiskExplainer.explain(RiskLabel.MALICIOUS, row));
    }
}
