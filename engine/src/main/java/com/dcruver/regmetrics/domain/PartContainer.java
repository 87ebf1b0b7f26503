package com.dcruver.regmetrics.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Sections of one part, keyed by section number in document order.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PartContainer {
    @JsonProperty("part_number")
    String partNumber;

    @JsonProperty("part_title")
    String partTitle;

    Map<String, SectionRecord> sections;
}
