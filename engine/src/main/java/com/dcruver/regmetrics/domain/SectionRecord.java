package com.dcruver.regmetrics.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Canonical section-level record, identified by (year, title, part, section).
 * Never patched: a re-conversion regenerates the whole TitleFile.
 */
@Value
@Builder
@Jacksonized
public class SectionRecord {
    String year;

    @JsonProperty("title_number")
    String titleNumber;

    @JsonProperty("part_number")
    String partNumber;

    @JsonProperty("part_title")
    String partTitle;

    @JsonProperty("subpart_number")
    String subpartNumber;  // null when the section sits directly under its part

    @JsonProperty("section_number")
    String sectionNumber;

    @JsonProperty("section_title")
    String sectionTitle;

    String content;

    @JsonProperty("content_status")
    ContentStatus contentStatus;

    public IndexEntry key() {
        return new IndexEntry(year, titleNumber, partNumber, sectionNumber);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return contentStatus == ContentStatus.EMPTY;
    }
}
