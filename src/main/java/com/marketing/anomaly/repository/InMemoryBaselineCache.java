package com.marketing.anomaly.repository;

import com.marketing.anomaly.config.AnomalyDetectionConfig;
import com.marketing.anomaly.model.Baseline;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local baseline cache. Concurrent misses on the same key may both compute; the
 * computation is idempotent and the last put wins.
 */
@Repository
public class InMemoryBaselineCache implements BaselineCache {

    private final ConcurrentHashMap<Key, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryBaselineCache(AnomalyDetectionConfig config, Clock clock) {
        this.clock = clock;
        this.ttl = Duration.ofMinutes(config.getCache().getTtlMinutes());
    }

    @Override
    public Optional<Baseline> get(Key key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.baseline());
    }

    @Override
    public void put(Key key, Baseline baseline) {
        entries.put(key, new Entry(baseline, clock.millis()));
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public int evictExpired() {
        int before = entries.size();
        entries.values().removeIf(this::isExpired);
        return before - entries.size();
    }

    @Override
    public int size() {
        return entries.size();
    }

    private boolean isExpired(Entry entry) {
        return clock.millis() - entry.storedAt() >= ttl.toMillis();
    }

    private record Entry(Baseline baseline, long storedAt) {
    }
}
