package com.dcruver.regmetrics.store;

import com.dcruver.regmetrics.domain.TitleFile;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persists TitleFiles as {@code <store>/<year>/title_<n>.json} and the corpus index as
 * {@code <store>/index.json}.
 *
 * Every file is written to a temp file beside its target and moved into place, so a
 * reader never sees a half-written TitleFile or index.
 */
@Component
@Slf4j
public class IndexedStoreWriter {

    public static final String INDEX_FILE = "index.json";

    private final Path storeRoot;
    private final ObjectMapper objectMapper;

    public IndexedStoreWriter(@Value("${regmetrics.store-dir}") String storeDir) {
        this.storeRoot = Path.of(storeDir).toAbsolutePath().normalize();
        this.objectMapper = storeMapper();
    }

    /**
     * Mapper shared by the writer and the lookup side so both agree on the file format
     */
    public static ObjectMapper storeMapper() {
        return new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static String locationOf(String year, String titleNumber) {
        return year + "/title_" + titleNumber + ".json";
    }

    public Path getStoreRoot() {
        return storeRoot;
    }

    /**
     * Write one TitleFile wholesale, replacing any previous version
     */
    public WrittenTitle write(TitleFile titleFile) throws StoreWriteException {
        String location = locationOf(titleFile.getYear(), titleFile.getTitleNumber());
        Path target = storeRoot.resolve(location);

        try {
            Files.createDirectories(target.getParent());
            writeAtomically(target, objectMapper.writeValueAsBytes(titleFile));
        } catch (IOException e) {
            throw new StoreWriteException("Failed to write " + target + ": " + e.getMessage(), e);
        }

        log.info("Wrote {} ({} parts, {} sections)", location, titleFile.getParts().size(), titleFile.sectionCount());
        return WrittenTitle.of(titleFile, location);
    }

    /**
     * Build and publish the index from the keys of fully written TitleFiles.
     * Must run after every write of the conversion has completed.
     */
    public StoreIndex buildIndex(List<WrittenTitle> written) throws StoreWriteException {
        Map<String, Map<String, IndexedTitle>> document = new TreeMap<>();

        for (WrittenTitle title : written) {
            Path backing = storeRoot.resolve(title.getLocation());
            if (!Files.isRegularFile(backing)) {
                throw new IndexInconsistencyException(
                    "Index would claim " + title.sectionCount() + " keys of " + title.getLocation() + " but the file does not exist");
            }

            Map<String, IndexedTitle> titles = document.computeIfAbsent(title.getYear(), k -> new TreeMap<>());
            IndexedTitle previous = titles.put(title.getTitleNumber(), IndexedTitle.builder()
                .file(title.getLocation())
                .parts(title.getParts())
                .build());
            if (previous != null) {
                throw new IndexInconsistencyException(
                    "Title " + title.getTitleNumber() + " of " + title.getYear() + " was admitted to the index twice");
            }
        }

        StoreIndex index = StoreIndex.from(document);
        Path indexPath = storeRoot.resolve(INDEX_FILE);
        try {
            Files.createDirectories(storeRoot);
            writeAtomically(indexPath, objectMapper.writeValueAsBytes(index.document()));
        } catch (IOException e) {
            throw new StoreWriteException("Failed to write index " + indexPath + ": " + e.getMessage(), e);
        }

        log.info("Published index with {} keys across {} title files", index.size(), written.size());
        return index;
    }

    /**
     * Remove the published index so an interrupted run leaves no index behind
     */
    public void clearIndex() throws StoreWriteException {
        Path indexPath = storeRoot.resolve(INDEX_FILE);
        try {
            if (Files.deleteIfExists(indexPath)) {
                log.info("Removed previous index {}", indexPath);
            }
        } catch (IOException e) {
            throw new StoreWriteException("Failed to remove index " + indexPath + ": " + e.getMessage(), e);
        }
    }

    private void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path tempFile = Files.createTempFile(target.getParent(), target.getFileName() + "-", ".tmp");
        try {
            Files.write(tempFile, bytes, StandardOpenOption.TRUNCATE_EXISTING);
            try {
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }
}
