package com.webapp.backend_telemetry.ml;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLabel {
    BENIGN("Benign"),
    BUGGY("Buggy"),
    MALICIOUS("Malicious");

    private final String displayName;

    RiskLabel(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
