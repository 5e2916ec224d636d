package com.behavior_ml_retraining.service;

import com.behavior_ml_retraining.config.StoragePathResolver;
import com.behavior_ml_retraining.dto.train.PerformanceRecord;
import com.behavior_ml_retraining.util.FileUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Append-only, size-bounded history of deployed model performance, mirrored to a JSON file.
 * The in-memory history is authoritative for the running process; the file only survives restarts.
 */
@Service
@Slf4j
public class MetricStore {

    public static final int DEFAULT_CAPACITY = 50;

    private final Path historyFile;
    private final int capacity;
    private final Clock clock;
    private final ObjectMapper objectMapper = FileUtil.jsonMapper();
    private final Deque<PerformanceRecord> history = new ArrayDeque<>();

    @Autowired
    public MetricStore(StoragePathResolver pathResolver,
                       @Value("${retraining.history.capacity:50}") int capacity,
                       Clock clock) {
        this(pathResolver.getHistoryFile(), capacity, clock);
    }

    public MetricStore(Path historyFile, int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive");
        }
        this.historyFile = historyFile;
        this.capacity = capacity;
        this.clock = clock;
        load();
    }

    public synchronized void append(PerformanceRecord record) {
        history.addLast(record);
        while (history.size() > capacity) {
            history.removeFirst();
        }
        persist();
    }

    /**
     * Most recent record, or the default baseline when nothing was deployed yet.
     */
    public synchronized PerformanceRecord latest() {
        PerformanceRecord last = history.peekLast();
        return last != null ? last : PerformanceRecord.baseline(clock.instant());
    }

    public synchronized Optional<PerformanceRecord> findLatest() {
        return Optional.ofNullable(history.peekLast());
    }

    /**
     * Mean accuracy of the last {@code k} records (all of them if fewer exist); NaN when empty.
     */
    public synchronized double recentMean(int k) {
        if (history.isEmpty() || k <= 0) {
            return Double.NaN;
        }
        int n = Math.min(k, history.size());
        double sum = 0.0;
        Iterator<PerformanceRecord> it = history.descendingIterator();
        for (int i = 0; i < n; i++) {
            sum += it.next().accuracy();
        }
        return sum / n;
    }

    public synchronized int size() {
        return history.size();
    }

    public synchronized boolean isEmpty() {
        return history.isEmpty();
    }

    public synchronized List<PerformanceRecord> history() {
        return new ArrayList<>(history);
    }

    private void persist() {
        try {
            FileUtil.writeJsonAtomically(objectMapper, historyFile, new ArrayList<>(history));
            log.debug("💾 Performance history saved ({} records) to {}", history.size(), historyFile);
        } catch (IOException e) {
            log.warn("⚠️ Failed to persist performance history to {}: {}", historyFile, e.getMessage(), e);
        }
    }

    private void load() {
        if (!Files.exists(historyFile)) {
            log.info("📭 No performance history at {}, starting empty", historyFile);
            return;
        }
        try {
            List<PerformanceRecord> stored = objectMapper.readValue(historyFile.toFile(), new TypeReference<>() {});
            int skip = Math.max(0, stored.size() - capacity);
            stored.stream().skip(skip).forEach(history::addLast);
            log.info("✅ Loaded {} performance records from {}", history.size(), historyFile);
        } catch (IOException e) {
            log.error("❌ Performance history at {} is unreadable, starting empty", historyFile, e);
        }
    }
}
