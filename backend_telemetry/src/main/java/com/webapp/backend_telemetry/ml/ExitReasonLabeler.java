package com.webapp.backend_telemetry.ml;

import com.webapp.backend_telemetry.dtos.FeatureRow;

/**
 * Derives training labels for real runs from their exit reason. This is the
 * only label source for real data; there is no human-verified ground truth.
 */
public final class ExitReasonLabeler {

    private ExitReasonLabeler() {
    }

    public static RiskLabel label(String exitReason) {
        String reason = exitReason == null ? "" : exitReason;
        if (reason.contains("VIOLATION")) return RiskLabel.MALICIOUS;
        if (reason.contains("SIGNALED")) return RiskLabel.BUGGY;
        return RiskLabel.BENIGN;
    }

    public static RiskLabel label(FeatureRow row) {
        return label(row.getExitReason());
    }
}
