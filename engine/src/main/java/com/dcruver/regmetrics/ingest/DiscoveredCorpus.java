package com.dcruver.regmetrics.ingest;

import com.dcruver.regmetrics.io.SourceFile;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Markup files found under an input directory, plus files whose names carry no
 * (year, title) and were therefore skipped.
 */
@Value
public class DiscoveredCorpus {
    List<SourceFile> files;
    List<Path> skipped;
}
