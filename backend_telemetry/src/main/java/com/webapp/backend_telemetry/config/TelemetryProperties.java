package com.webapp.backend_telemetry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code telemetry.*} keys of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "telemetry")
public class TelemetryProperties {

    /**
     * Directory the sandbox runner writes its JSON logs into.
     */
    private String logDir = "../logs";

    private Classifier classifier = new Classifier();

    private Dashboard dashboard = new Dashboard();

    @Data
    public static class Classifier {
        /**
         * Smallest batch of real runs worth retraining on.
         */
        private int minTrainingRows = 5;

        /**
         * Cap on the real rows blended with the seed set, most recent first. 0 keeps all.
         */
        private int maxRealRows = 0;

        private int trees = 10;

        private int seed = 42;
    }

    @Data
    public static class Dashboard {
        /**
         * Runs returned by the run table and overview. 0 returns every run.
         */
        private int maxRuns = 50;
    }
}
