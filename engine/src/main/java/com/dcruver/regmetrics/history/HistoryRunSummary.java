package com.dcruver.regmetrics.history;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class HistoryRunSummary {
    int documents;
    int records;
    int alreadyStored;
    int skippedVersions;
    List<String> failedDocuments;
    Duration elapsed;
}
