package com.marketing.anomaly.repository;

import com.marketing.anomaly.model.Aggregation;
import com.marketing.anomaly.model.Baseline;

import java.util.Optional;

/**
 * Store for computed baselines keyed by (metric, period, aggregation).
 * Entries are replaced, never mutated; freshness is decided by the implementation's TTL.
 */
public interface BaselineCache {

    Optional<Baseline> get(Key key);

    void put(Key key, Baseline baseline);

    void clear();

    /**
     * Drop entries past their TTL. Returns the number removed.
     */
    int evictExpired();

    int size();

    record Key(String metric, int periodDays, Aggregation aggregation) {
    }
}
