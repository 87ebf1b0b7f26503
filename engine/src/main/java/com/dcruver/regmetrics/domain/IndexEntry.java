package com.dcruver.regmetrics.domain;

import lombok.Value;

/**
 * Composite lookup key of a section across the whole corpus.
 */
@Value
public class IndexEntry {
    String year;
    String titleNumber;
    String partNumber;
    String sectionNumber;

    @Override
    public String toString() {
        return year + "/" + titleNumber + "/" + partNumber + "/" + sectionNumber;
    }
}
