package com.webapp.backend_telemetry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BackendTelemetryApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackendTelemetryApplication.class, args);
    }
}
