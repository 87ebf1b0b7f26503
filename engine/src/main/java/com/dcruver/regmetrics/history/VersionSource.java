package com.dcruver.regmetrics.history;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the version history of each document.
 */
public interface VersionSource {

    List<String> documentIds() throws IOException;

    /**
     * Versions of one document, expected newest first
     */
    List<VersionRecord> versions(String documentId) throws IOException;
}
