package com.webapp.backend_telemetry.dtos;

import com.webapp.backend_telemetry.ml.RiskLabel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Classifier verdict for one run. {@code reason} comes from the rule-based
 * explainer and may disagree with {@code prediction}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskPrediction {
    private RiskLabel prediction;
    private double confidence;
    private String reason;
}
