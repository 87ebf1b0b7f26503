package com.dcruver.regmetrics.ingest;

import com.dcruver.regmetrics.store.WrittenTitle;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of converting one (year, title) unit.
 */
@Value
@Builder
public class UnitResult {
    String unitKey;
    int fileCount;
    boolean succeeded;
    WrittenTitle written;        // null unless succeeded
    int writeAttempts;
    String failureReason;        // null when succeeded
    List<FileFailure> fileFailures;

    public int sectionCount() {
        return written != null ? written.sectionCount() : 0;
    }
}
