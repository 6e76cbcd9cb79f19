package com.webapp.backend_telemetry.ml;

public class ModelTrainingException extends RuntimeException {
    public ModelTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
