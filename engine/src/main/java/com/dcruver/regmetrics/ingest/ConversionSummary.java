package com.dcruver.regmetrics.ingest;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * What a conversion run did: which units were published and which were not.
 */
@Value
@Builder
public class ConversionSummary {
    Instant startedAt;
    Duration elapsed;
    int workers;
    List<UnitResult> succeeded;
    List<UnitResult> failed;
    List<FileFailure> fileFailures;
    List<Path> skippedFiles;
    int indexedKeys;

    public int totalUnits() {
        return succeeded.size() + failed.size();
    }

    public int sectionCount() {
        return succeeded.stream().mapToInt(UnitResult::sectionCount).sum();
    }

    public boolean isClean() {
        return failed.isEmpty() && fileFailures.isEmpty();
    }
}
