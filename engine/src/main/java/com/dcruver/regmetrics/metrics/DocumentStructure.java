package com.dcruver.regmetrics.metrics;

import lombok.Value;

/**
 * Structure counts taken from a parsed version tree.
 */
@Value
public class DocumentStructure {
    public static final DocumentStructure NONE = new DocumentStructure(0, 0);

    int sectionCount;
    int subpartCount;
}
