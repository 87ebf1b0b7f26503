package com.dcruver.regmetrics.history;

import com.dcruver.regmetrics.metrics.MetricsRecord;

import java.time.LocalDate;

/**
 * Receives metrics records as a walk produces them. Must tolerate concurrent callers.
 */
public interface MetricsSink {

    void accept(MetricsRecord record);

    /**
     * Whether a record for this document and date is already stored. Sinks that keep
     * nothing report false, so every record is handed over.
     */
    default boolean contains(String documentId, LocalDate metricsDate) {
        return false;
    }
}
