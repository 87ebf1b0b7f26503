package com.dcruver.regmetrics.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.Set;

/**
 * One historical version of a document.
 */
@Value
@Builder
@Jacksonized
public class VersionRecord {
    @JsonProperty("document_id")
    String documentId;

    @JsonProperty("version_date")
    LocalDate versionDate;

    @JsonProperty("raw_text")
    String rawText;

    @JsonProperty("revision_author_ids")
    Set<String> revisionAuthorIds;
}
