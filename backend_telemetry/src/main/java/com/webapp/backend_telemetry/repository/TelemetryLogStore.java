package com.webapp.backend_telemetry.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webapp.backend_telemetry.config.TelemetryProperties;
import com.webapp.backend_telemetry.dtos.LogEntry;
import com.webapp.backend_telemetry.dtos.RawRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON telemetry files dropped by the sandbox runner. A file that
 * cannot be read or parsed is logged and skipped; it never fails the batch.
 */
@Slf4j
@Repository
public class TelemetryLogStore {
    private static final String LOG_GLOB = "*.json";

    private final ObjectMapper objectMapper;
    private final Path logDir;

    public TelemetryLogStore(ObjectMapper objectMapper, TelemetryProperties properties) {
        this.objectMapper = objectMapper;
        this.logDir = Paths.get(properties.getLogDir());
    }

    public List<LogEntry> loadAll() {
        List<LogEntry> entries = new ArrayList<>();
        for (Path file : listLogFiles()) {
            try {
                RawRecord record = objectMapper.readValue(file.toFile(), RawRecord.class);
                if (record == null) {
                    log.warn("Skipping empty telemetry log {}", file);
                    continue;
                }
                entries.add(LogEntry.builder()
                        .source(file.toString())
                        .lastModified(Files.getLastModifiedTime(file).toInstant())
                        .record(record)
                        .build());
            } catch (IOException e) {
                log.warn("Error reading {}: {}", file, e.getMessage());
            }
        }
        log.debug("Loaded {} telemetry logs from {}", entries.size(), logDir);
        return entries;
    }

    /**
     * Number of candidate log files, without parsing them.
     */
    public int countRecords() {
        return listLogFiles().size();
    }

    private List<Path> listLogFiles() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(logDir)) {
            log.warn("Telemetry log directory {} does not exist", logDir);
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(logDir, LOG_GLOB)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) files.add(file);
            }
        } catch (IOException e) {
            log.warn("Could not list telemetry log directory {}: {}", logDir, e.getMessage());
        }
        return files;
    }
}
