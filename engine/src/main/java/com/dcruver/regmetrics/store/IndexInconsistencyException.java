package com.dcruver.regmetrics.store;

/**
 * The index claims a key that no written TitleFile backs. Aborts the run.
 */
public class IndexInconsistencyException extends IllegalStateException {

    public IndexInconsistencyException(String message) {
        super(message);
    }
}
