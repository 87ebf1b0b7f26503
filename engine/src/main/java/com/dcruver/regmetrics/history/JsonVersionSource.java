package com.dcruver.regmetrics.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads version histories from {@code <versions-dir>/<document_id>.json}, each a JSON
 * array of versions.
 */
@Component
@Slf4j
public class JsonVersionSource implements VersionSource {

    private static final String SUFFIX = ".json";

    private final Path versionsDir;
    private final ObjectMapper objectMapper;

    public JsonVersionSource(@Value("${regmetrics.history.versions-dir}") String versionsDir) {
        this.versionsDir = Path.of(versionsDir).toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public List<String> documentIds() throws IOException {
        if (!Files.isDirectory(versionsDir)) {
            throw new IOException("Versions directory does not exist: " + versionsDir);
        }

        List<String> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(versionsDir)) {
            files.filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .sorted()
                .forEach(name -> ids.add(name.substring(0, name.length() - SUFFIX.length())));
        }

        log.info("Found version histories for {} documents in {}", ids.size(), versionsDir);
        return ids;
    }

    @Override
    public List<VersionRecord> versions(String documentId) throws IOException {
        Path file = versionsDir.resolve(documentId + SUFFIX);
        List<VersionRecord> versions = objectMapper.readValue(file.toFile(), new TypeReference<List<VersionRecord>>() {});
        log.debug("Loaded {} versions of {}", versions.size(), documentId);
        return versions;
    }
}
