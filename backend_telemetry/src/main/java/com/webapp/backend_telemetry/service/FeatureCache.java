package com.webapp.backend_telemetry.service;

import com.webapp.backend_telemetry.dtos.FeatureRow;
import com.webapp.backend_telemetry.dtos.LogEntry;
import com.webapp.backend_telemetry.ml.RiskClassifier;
import com.webapp.backend_telemetry.ml.RiskModel;
import com.webapp.backend_telemetry.repository.TelemetryLogStore;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Memoized feature table, keyed on the number of log files on disk.
 * <p>
 * Checking the count, re-extracting, retraining the classifier and swapping
 * the entry happen under one lock, so callers never see a table paired with a
 * model from another epoch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureCache {
    private static final Comparator<LogEntry> MOST_RECENT_FIRST = Comparator
            .comparing((LogEntry e) -> e.getLastModified() == null ? Instant.EPOCH : e.getLastModified())
            .reversed()
            .thenComparing(e -> e.getSource() == null ? "" : e.getSource());

    private final TelemetryLogStore logStore;
    private final FeatureExtractor featureExtractor;
    private final RiskClassifier riskClassifier;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile CacheEntry entry;

    public CacheEntry getFeatures() {
        lock.lock();
        try {
            int count = logStore.countRecords();
            CacheEntry current = entry;
            if (current != null && current.getSourceCount() == count) {
                return current;
            }
            entry = rebuild(count);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the cached table so the next {@link #getFeatures()} recomputes.
     */
    public void invalidate() {
        lock.lock();
        try {
            entry = null;
        } finally {
            lock.unlock();
        }
    }

    private CacheEntry rebuild(int count) {
        List<LogEntry> logs = new ArrayList<>(logStore.loadAll());
        logs.sort(MOST_RECENT_FIRST);
        List<FeatureRow> table = Collections.unmodifiableList(featureExtractor.extract(logs));

        riskClassifier.train(table);
        log.info("Feature cache rebuilt: {} files, {} rows", count, table.size());
        return new CacheEntry(table, count, riskClassifier.getModel());
    }

    @Getter
    @AllArgsConstructor
    public static class CacheEntry {
        private final List<FeatureRow> featureTable;
        private final int sourceCount;
        private final RiskModel model;
    }
}
