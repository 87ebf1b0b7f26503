package com.dcruver.regmetrics.domain;

/**
 * Distinguishes a section that was processed and has no body text (e.g. "[Reserved]")
 * from one carrying extracted text.
 */
public enum ContentStatus {
    EXTRACTED,
    EMPTY
}
