package com.dcruver.regmetrics.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage unit: every part and section of one title for one year.
 * No two workers ever write the same (year, title) concurrently.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TitleFile {
    String year;

    @JsonProperty("title_number")
    String titleNumber;

    String volume;

    Map<String, PartContainer> parts;

    public Optional<SectionRecord> findSection(String partNumber, String sectionNumber) {
        PartContainer part = parts.get(partNumber);
        if (part == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(part.getSections().get(sectionNumber));
    }

    /**
     * Every (year, title, part, section) key held by this file
     */
    public List<IndexEntry> keys() {
        List<IndexEntry> keys = new ArrayList<>();
        for (PartContainer part : parts.values()) {
            for (String sectionNumber : part.getSections().keySet()) {
                keys.add(new IndexEntry(year, titleNumber, part.getPartNumber(), sectionNumber));
            }
        }
        return keys;
    }

    public int sectionCount() {
        return parts.values().stream().mapToInt(part -> part.getSections().size()).sum();
    }
}
