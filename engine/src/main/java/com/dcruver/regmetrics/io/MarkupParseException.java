package com.dcruver.regmetrics.io;

/**
 * Markup could not be parsed. Scoped to one file or one version text.
 */
public class MarkupParseException extends Exception {

    public MarkupParseException(String message) {
        super(message);
    }

    public MarkupParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
