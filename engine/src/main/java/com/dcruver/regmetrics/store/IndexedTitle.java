package com.dcruver.regmetrics.store;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Index view of a TitleFile: where it lives and which keys it holds.
 */
@Value
@Builder
@Jacksonized
public class IndexedTitle {
    String file;  // relative to the store root
    Map<String, IndexedPart> parts;
}
