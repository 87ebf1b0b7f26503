package com.dcruver.regmetrics.history;

import lombok.Builder;
import lombok.Value;

/**
 * Averages of the stored metrics records dated in one year
 */
@Value
@Builder
public class YearlyMetrics {
    String year;
    int records;
    int documents;
    double averageWordCount;
    double averageComplexity;
    double averageReadability;
    double averageSimplicity;
    double averageCombinedReadability;
}
