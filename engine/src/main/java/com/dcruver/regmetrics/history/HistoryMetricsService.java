package com.dcruver.regmetrics.history;

import com.dcruver.regmetrics.io.HierarchyParser;
import com.dcruver.regmetrics.metrics.MetricsCalculator;
import com.dcruver.regmetrics.metrics.MetricsRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Computes historical metrics for every document of a version source. Documents run in
 * parallel; each document's walk is sequential.
 */
@Component
@Slf4j
public class HistoryMetricsService {

    private final VersionSource versionSource;
    private final HierarchyParser parser;
    private final MetricsCalculator calculator;
    private final MetricsSink sink;
    private final int workers;

    public HistoryMetricsService(
        VersionSource versionSource,
        HierarchyParser parser,
        MetricsCalculator calculator,
        MetricsSink sink,
        @Value("${regmetrics.history.workers:4}") int workers
    ) {
        this.versionSource = versionSource;
        this.parser = parser;
        this.calculator = calculator;
        this.sink = sink;
        this.workers = Math.max(1, workers);
    }

    /**
     * Incremental run: versions whose (document, date) the sink already holds are walked
     * for their authors but not stored again
     */
    public HistoryRunSummary computeAll() throws IOException, InterruptedException {
        return computeAll(false);
    }

    public HistoryRunSummary computeAll(boolean recompute) throws IOException, InterruptedException {
        Instant startedAt = Instant.now();
        List<String> documentIds = versionSource.documentIds();
        log.info("Computing historical metrics for {} documents with {} workers{}", documentIds.size(), workers,
            recompute ? ", recomputing stored records" : "");

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        List<Future<DocumentHistoryRun>> futures = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        int records = 0;
        int alreadyStored = 0;
        int skipped = 0;

        try {
            for (String documentId : documentIds) {
                futures.add(executor.submit(() -> compute(documentId, recompute)));
            }

            for (int i = 0; i < futures.size(); i++) {
                try {
                    DocumentHistoryRun run = futures.get(i).get();
                    records += run.getStored();
                    alreadyStored += run.getAlreadyStored();
                    skipped += run.getSkippedVersions();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Failed to compute metrics for {}", documentIds.get(i), cause);
                    failed.add(documentIds.get(i));
                }
            }
        } catch (InterruptedException e) {
            log.warn("Historical metrics run interrupted; cancelling pending documents");
            executor.shutdownNow();
            throw e;
        } finally {
            executor.shutdown();
        }

        HistoryRunSummary summary = HistoryRunSummary.builder()
            .documents(documentIds.size())
            .records(records)
            .alreadyStored(alreadyStored)
            .skippedVersions(skipped)
            .failedDocuments(failed)
            .elapsed(Duration.between(startedAt, Instant.now()))
            .build();

        log.info("Historical metrics finished: {} records for {} documents, {} already stored, {} versions skipped, {} documents failed",
            records, documentIds.size(), alreadyStored, skipped, failed.size());
        return summary;
    }

    /**
     * Walk one document's history and hand each new record to the sink as it is produced.
     * The walk always covers every version, so author totals stay cumulative whether or not
     * a record is stored.
     */
    public DocumentHistoryRun compute(String documentId, boolean recompute) throws IOException {
        VersionHistoryWalker walker = new VersionHistoryWalker(
            documentId, versionSource.versions(documentId), parser, calculator);

        int stored = 0;
        int alreadyStored = 0;
        while (walker.getState() != WalkState.DONE) {
            Optional<MetricsRecord> record = walker.step();
            if (record.isEmpty()) {
                continue;
            }
            if (!recompute && sink.contains(documentId, record.get().getMetricsDate())) {
                alreadyStored++;
            } else {
                sink.accept(record.get());
                stored++;
            }
        }

        if (alreadyStored > 0) {
            log.debug("{}: {} records already stored", documentId, alreadyStored);
        }
        return DocumentHistoryRun.builder()
            .documentId(documentId)
            .stored(stored)
            .alreadyStored(alreadyStored)
            .skippedVersions(walker.skipped())
            .build();
    }
}
