package com.dcruver.regmetrics.store;

/**
 * A TitleFile or the index could not be persisted.
 */
public class StoreWriteException extends Exception {

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
