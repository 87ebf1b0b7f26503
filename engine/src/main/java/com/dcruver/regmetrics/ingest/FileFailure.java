package com.dcruver.regmetrics.ingest;

import lombok.Value;

import java.nio.file.Path;

/**
 * A markup file that could not be parsed. Other files of the run are unaffected.
 */
@Value
public class FileFailure {
    Path path;
    String message;
}
