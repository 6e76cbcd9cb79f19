package com.webapp.backend_telemetry.dtos;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A feature row with the classifier verdict flattened next to it. When the
 * prediction failed the {@code prediction}, {@code confidence} and
 * {@code reason} keys are simply absent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnrichedRun {
    @JsonUnwrapped
    private FeatureRow features;

    @JsonUnwrapped
    private RiskPrediction risk;

    @JsonIgnore
    public boolean isEnriched() {
        return risk != null;
    }
}
