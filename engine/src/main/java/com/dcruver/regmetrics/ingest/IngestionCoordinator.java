package com.dcruver.regmetrics.ingest;

import com.dcruver.regmetrics.domain.CanonicalRecordBuilder;
import com.dcruver.regmetrics.domain.SectionRecord;
import com.dcruver.regmetrics.domain.TitleFile;
import com.dcruver.regmetrics.io.HierarchyParser;
import com.dcruver.regmetrics.io.MarkupParseException;
import com.dcruver.regmetrics.io.ParsedTitle;
import com.dcruver.regmetrics.io.SourceFile;
import com.dcruver.regmetrics.store.IndexedStoreWriter;
import com.dcruver.regmetrics.store.StoreIndex;
import com.dcruver.regmetrics.store.StoreWriteException;
import com.dcruver.regmetrics.store.WrittenTitle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Converts a corpus of bulk markup files into the indexed store.
 *
 * Files are grouped into (year, title) units. A unit is handled start to finish by one
 * worker, so no two workers ever write the same TitleFile. The index is built once, after
 * every unit has finished, from the units that were written successfully.
 */
@Component
@Slf4j
public class IngestionCoordinator {

    private final CorpusDiscovery discovery;
    private final HierarchyParser parser;
    private final CanonicalRecordBuilder recordBuilder;
    private final IndexedStoreWriter storeWriter;
    private final int workers;
    private final int writeAttempts;

    public IngestionCoordinator(
        CorpusDiscovery discovery,
        HierarchyParser parser,
        CanonicalRecordBuilder recordBuilder,
        IndexedStoreWriter storeWriter,
        @Value("${regmetrics.ingest.workers:4}") int workers,
        @Value("${regmetrics.ingest.write-retries:3}") int writeAttempts
    ) {
        this.discovery = discovery;
        this.parser = parser;
        this.recordBuilder = recordBuilder;
        this.storeWriter = storeWriter;
        this.workers = Math.max(1, workers);
        this.writeAttempts = Math.max(1, writeAttempts);
    }

    /**
     * Discover, convert and index every markup file under the input directory
     */
    public ConversionSummary convert(Path inputDir) throws IOException, StoreWriteException, InterruptedException {
        DiscoveredCorpus corpus = discovery.discover(inputDir);
        return convert(corpus.getFiles(), corpus.getSkipped());
    }

    public ConversionSummary convert(List<SourceFile> files, List<Path> skipped)
        throws StoreWriteException, InterruptedException {
        Instant startedAt = Instant.now();

        // Units sorted by key so results and index input are independent of scheduling
        Map<String, List<SourceFile>> units = new TreeMap<>();
        for (SourceFile file : files) {
            units.computeIfAbsent(file.unitKey(), k -> new ArrayList<>()).add(file);
        }
        units.values().forEach(unitFiles -> unitFiles.sort(null));

        log.info("Converting {} files in {} units with {} workers", files.size(), units.size(), workers);

        // An interrupted run must leave no index behind
        storeWriter.clearIndex();

        List<UnitResult> results = runUnits(units);

        List<UnitResult> succeeded = new ArrayList<>();
        List<UnitResult> failed = new ArrayList<>();
        List<FileFailure> fileFailures = new ArrayList<>();
        List<WrittenTitle> written = new ArrayList<>();

        for (UnitResult result : results) {
            fileFailures.addAll(result.getFileFailures());
            if (result.isSucceeded()) {
                succeeded.add(result);
                written.add(result.getWritten());
            } else {
                failed.add(result);
            }
        }

        StoreIndex index = storeWriter.buildIndex(written);

        ConversionSummary summary = ConversionSummary.builder()
            .startedAt(startedAt)
            .elapsed(Duration.between(startedAt, Instant.now()))
            .workers(workers)
            .succeeded(succeeded)
            .failed(failed)
            .fileFailures(fileFailures)
            .skippedFiles(List.copyOf(skipped))
            .indexedKeys(index.size())
            .build();

        log.info("Conversion finished: {} units succeeded, {} failed, {} file failures, {} indexed sections in {} ms",
            succeeded.size(), failed.size(), fileFailures.size(), index.size(), summary.getElapsed().toMillis());
        return summary;
    }

    private List<UnitResult> runUnits(Map<String, List<SourceFile>> units) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<UnitResult>> futures = new ArrayList<>();
            units.forEach((unitKey, unitFiles) -> futures.add(executor.submit(() -> convertUnit(unitKey, unitFiles))));

            // Barrier: every unit finishes before the index is touched
            List<UnitResult> results = new ArrayList<>();
            List<String> keys = new ArrayList<>(units.keySet());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(keys.get(i), units.get(keys.get(i)).size(), futures.get(i)));
            }
            return results;
        } catch (InterruptedException e) {
            log.warn("Conversion interrupted; cancelling pending units, index will not be built");
            executor.shutdownNow();
            throw e;
        } finally {
            executor.shutdown();
        }
    }

    private UnitResult await(String unitKey, int fileCount, Future<UnitResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Unit {} failed unexpectedly", unitKey, cause);
            return UnitResult.builder()
                .unitKey(unitKey)
                .fileCount(fileCount)
                .succeeded(false)
                .failureReason(cause.toString())
                .fileFailures(List.of())
                .build();
        }
    }

    /**
     * Parse every file of one unit in volume order, merge them and write the TitleFile.
     */
    UnitResult convertUnit(String unitKey, List<SourceFile> unitFiles) {
        List<FileFailure> fileFailures = new ArrayList<>();
        TitleFile merged = null;

        for (SourceFile file : unitFiles) {
            try {
                ParsedTitle parsed = parser.parse(file);
                List<SectionRecord> records = recordBuilder.build(parsed, file.getYear(), file.getTitleNumber());
                TitleFile titleFile = recordBuilder.toTitleFile(file, records);
                merged = merged == null ? titleFile : recordBuilder.merge(merged, titleFile);
                log.info("Parsed {}: {} sections", file, records.size());
            } catch (MarkupParseException | RuntimeException e) {
                log.error("Failed to parse {}: {}", file, e.getMessage());
                fileFailures.add(new FileFailure(file.getPath(), e.getMessage()));
            }
        }

        UnitResult.UnitResultBuilder result = UnitResult.builder()
            .unitKey(unitKey)
            .fileCount(unitFiles.size())
            .fileFailures(List.copyOf(fileFailures));

        if (merged == null) {
            log.error("Unit {} has no parsable files", unitKey);
            return result.succeeded(false).failureReason("no parsable files").build();
        }

        StoreWriteException lastFailure = null;
        for (int attempt = 1; attempt <= writeAttempts; attempt++) {
            try {
                WrittenTitle written = storeWriter.write(merged);
                return result.succeeded(true).written(written).writeAttempts(attempt).build();
            } catch (StoreWriteException e) {
                lastFailure = e;
                log.warn("Write attempt {}/{} for unit {} failed: {}", attempt, writeAttempts, unitKey, e.getMessage());
            }
        }

        log.error("Unit {} could not be written after {} attempts", unitKey, writeAttempts, lastFailure);
        return result.succeeded(false)
            .writeAttempts(writeAttempts)
            .failureReason(lastFailure.getMessage())
            .build();
    }
}
