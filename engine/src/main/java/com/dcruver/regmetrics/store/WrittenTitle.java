package com.dcruver.regmetrics.store;

import com.dcruver.regmetrics.domain.IndexEntry;
import com.dcruver.regmetrics.domain.PartContainer;
import com.dcruver.regmetrics.domain.TitleFile;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keys of a TitleFile that has been fully written, ready to be admitted to the index.
 */
@Value
public class WrittenTitle {
    String year;
    String titleNumber;
    String location;
    Map<String, IndexedPart> parts;

    static WrittenTitle of(TitleFile titleFile, String location) {
        Map<String, IndexedPart> parts = new LinkedHashMap<>();
        for (PartContainer part : titleFile.getParts().values()) {
            parts.put(part.getPartNumber(), IndexedPart.builder()
                .partTitle(part.getPartTitle())
                .sections(List.copyOf(part.getSections().keySet()))
                .build());
        }
        return new WrittenTitle(titleFile.getYear(), titleFile.getTitleNumber(), location, parts);
    }

    public List<IndexEntry> keys() {
        List<IndexEntry> keys = new ArrayList<>();
        parts.forEach((partNumber, part) -> part.getSections()
            .forEach(section -> keys.add(new IndexEntry(year, titleNumber, partNumber, section))));
        return keys;
    }

    public int sectionCount() {
        return parts.values().stream().mapToInt(part -> part.getSections().size()).sum();
    }
}
