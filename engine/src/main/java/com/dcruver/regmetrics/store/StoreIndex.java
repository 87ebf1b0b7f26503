package com.dcruver.regmetrics.store;

import com.dcruver.regmetrics.domain.IndexEntry;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Corpus-wide key → TitleFile location map. Membership and location are O(1).
 * Rebuilt after each conversion, never patched.
 */
public class StoreIndex {

    private final Map<String, Map<String, IndexedTitle>> document;
    private final Map<IndexEntry, String> locations = new HashMap<>();

    private StoreIndex(Map<String, Map<String, IndexedTitle>> document) {
        this.document = document;
        document.forEach((year, titles) -> titles.forEach((titleNumber, title) ->
            title.getParts().forEach((partNumber, part) -> part.getSections().forEach(section ->
                locations.put(new IndexEntry(year, titleNumber, partNumber, section), title.getFile())))));
    }

    public static StoreIndex from(Map<String, Map<String, IndexedTitle>> document) {
        Map<String, Map<String, IndexedTitle>> sorted = new TreeMap<>();
        document.forEach((year, titles) -> sorted.put(year, new TreeMap<>(titles)));
        return new StoreIndex(sorted);
    }

    public boolean contains(IndexEntry key) {
        return locations.containsKey(key);
    }

    public Optional<String> locate(IndexEntry key) {
        return Optional.ofNullable(locations.get(key));
    }

    public int size() {
        return locations.size();
    }

    /**
     * Serializable form: year → title → {file, parts}
     */
    public Map<String, Map<String, IndexedTitle>> document() {
        return Collections.unmodifiableMap(document);
    }

    public Set<String> years() {
        return document.keySet();
    }

    public Set<String> titles(String year) {
        return document.getOrDefault(year, Map.of()).keySet();
    }

    public Set<String> parts(String year, String titleNumber) {
        IndexedTitle title = document.getOrDefault(year, Map.of()).get(titleNumber);
        return title != null ? title.getParts().keySet() : Set.of();
    }

    public List<String> sections(String year, String titleNumber, String partNumber) {
        IndexedTitle title = document.getOrDefault(year, Map.of()).get(titleNumber);
        if (title == null || !title.getParts().containsKey(partNumber)) {
            return List.of();
        }
        return title.getParts().get(partNumber).getSections();
    }
}
