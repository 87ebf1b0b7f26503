package com.dcruver.regmetrics.history;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of walking one document's history
 */
@Value
@Builder
public class DocumentHistoryRun {
    String documentId;
    int stored;             // records handed to the sink
    int alreadyStored;      // records the sink already held, not handed over again
    int skippedVersions;
}
