package com.webapp.backend_telemetry.dtos;

public enum ExitCategory {
    EXITED,
    SIGNALED,
    VIOLATION,
    UNKNOWN;

    public static ExitCategory of(String exitReason) {
        if (exitReason == null || exitReason.isBlank()) return UNKNOWN;
        if (exitReason.contains("VIOLATION")) return VIOLATION;
        if (exitReason.contains("SIGNALED")) return SIGNALED;
        if (exitReason.startsWith("EXITED")) return EXITED;
        return UNKNOWN;
    }
}
