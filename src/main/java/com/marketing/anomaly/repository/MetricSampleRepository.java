package com.marketing.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.marketing.anomaly.config.AerospikeConfig;
import com.marketing.anomaly.exception.MetricSourceException;
import com.marketing.anomaly.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

@Repository
public class MetricSampleRepository implements MetricSource {

    private static final Logger log = LoggerFactory.getLogger(MetricSampleRepository.class);

    static final String BIN_METRIC = "metric";
    static final String BIN_TIMESTAMP = "timestamp";
    static final String BIN_VALUE = "value";

    private final AerospikeClient client;
    private final String namespace;

    public MetricSampleRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    @Override
    public List<MetricSample> query(String metric, long fromMillis, long toMillis) {
        List<MetricSample> results = new ArrayList<>();
        try {
            client.scanAll(newScanPolicy(), namespace, AerospikeConfig.SET_METRIC_SAMPLES,
                    (key, record) -> {
                        if (!metric.equals(record.getString(BIN_METRIC))) return;
                        long ts = record.getLong(BIN_TIMESTAMP);
                        if (ts < fromMillis || ts > toMillis) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    });
        } catch (AerospikeException e) {
            throw new MetricSourceException("Failed to query samples for metric " + metric, e);
        }

        results.sort(Comparator.comparingLong(MetricSample::getTimestamp));
        log.debug("Loaded {} samples for {} in [{}, {}]", results.size(), metric, fromMillis, toMillis);
        return results;
    }

    @Override
    public MetricSample latest(String metric) {
        AtomicReference<MetricSample> latest = new AtomicReference<>();
        try {
            client.scanAll(newScanPolicy(), namespace, AerospikeConfig.SET_METRIC_SAMPLES,
                    (key, record) -> {
                        if (!metric.equals(record.getString(BIN_METRIC))) return;
                        MetricSample candidate = mapRecord(record);
                        latest.accumulateAndGet(candidate, (current, next) ->
                                current == null || next.getTimestamp() > current.getTimestamp() ? next : current);
                    });
        } catch (AerospikeException e) {
            throw new MetricSourceException("Failed to read latest sample for metric " + metric, e);
        }
        return latest.get();
    }

    private ScanPolicy newScanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.maxRecords = 0;
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;
        return scanPolicy;
    }

    private MetricSample mapRecord(Record record) {
        return MetricSample.builder()
                .metric(record.getString(BIN_METRIC))
                .timestamp(record.getLong(BIN_TIMESTAMP))
                .value(record.getDouble(BIN_VALUE))
                .build();
    }
}
