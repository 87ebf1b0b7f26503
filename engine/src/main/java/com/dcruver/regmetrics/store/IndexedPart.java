package com.dcruver.regmetrics.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Index view of a part: its title and section numbers, no content.
 */
@Value
@Builder
@Jacksonized
public class IndexedPart {
    @JsonProperty("part_title")
    String partTitle;

    List<String> sections;
}
