package com.dcruver.regmetrics.store;

import com.dcruver.regmetrics.domain.IndexEntry;
import com.dcruver.regmetrics.domain.SectionRecord;
import com.dcruver.regmetrics.domain.TitleFile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Constant-time section lookup: consult the index, load exactly one TitleFile,
 * return one record.
 */
@Component
@Slf4j
public class SectionLookup {

    private static final TypeReference<Map<String, Map<String, IndexedTitle>>> INDEX_TYPE = new TypeReference<>() {};

    private final Path storeRoot;
    private final ObjectMapper objectMapper;
    private StoreIndex index;

    public SectionLookup(@Value("${regmetrics.store-dir}") String storeDir) {
        this.storeRoot = Path.of(storeDir).toAbsolutePath().normalize();
        this.objectMapper = IndexedStoreWriter.storeMapper();
    }

    public Optional<SectionRecord> lookup(String year, String titleNumber, String partNumber, String sectionNumber)
        throws IOException {
        IndexEntry key = new IndexEntry(year.strip(), titleNumber.strip(), partNumber.strip(), sectionNumber.strip());

        Optional<String> location = index().locate(key);
        if (location.isEmpty()) {
            log.debug("No index entry for {}", key);
            return Optional.empty();
        }

        TitleFile titleFile = loadTitleFile(location.get());
        Optional<SectionRecord> record = titleFile.findSection(key.getPartNumber(), key.getSectionNumber());
        if (record.isEmpty()) {
            throw new IndexInconsistencyException("Index claims " + key + " but " + location.get() + " does not hold it");
        }
        return record;
    }

    public boolean exists(String year, String titleNumber, String partNumber, String sectionNumber) throws IOException {
        return index().contains(new IndexEntry(year.strip(), titleNumber.strip(), partNumber.strip(), sectionNumber.strip()));
    }

    /**
     * The published index, loaded once and cached until {@link #reload()}
     */
    public synchronized StoreIndex index() throws IOException {
        if (index == null) {
            Path indexPath = storeRoot.resolve(IndexedStoreWriter.INDEX_FILE);
            if (!Files.exists(indexPath)) {
                throw new NoSuchFileException(indexPath.toString(), null, "index not found; run a conversion first");
            }
            index = StoreIndex.from(objectMapper.readValue(indexPath.toFile(), INDEX_TYPE));
            log.info("Loaded index with {} keys from {}", index.size(), indexPath);
        }
        return index;
    }

    public synchronized void reload() {
        index = null;
    }

    public TitleFile loadTitleFile(String location) throws IOException {
        return objectMapper.readValue(storeRoot.resolve(location).toFile(), TitleFile.class);
    }
}
