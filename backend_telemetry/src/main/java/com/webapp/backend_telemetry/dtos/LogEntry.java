package com.webapp.backend_telemetry.dtos;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A parsed record tagged with where it came from.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LogEntry {
    private String source;
    private Instant lastModified;
    private RawRecord record;
}
