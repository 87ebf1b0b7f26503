package com.dcruver.regmetrics.ingest;

import com.dcruver.regmetrics.io.SourceFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds bulk markup files under an input directory.
 */
@Component
@Slf4j
public class CorpusDiscovery {

    public DiscoveredCorpus discover(Path inputDir) throws IOException {
        Path root = inputDir.toAbsolutePath().normalize();

        if (!Files.isDirectory(root)) {
            throw new IOException("Input path is not a directory: " + root);
        }

        log.info("Scanning markup corpus at: {}", root);

        List<SourceFile> files = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();

        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> markupFiles = paths
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase().endsWith(".xml"))
                .sorted()
                .toList();

            for (Path path : markupFiles) {
                Optional<SourceFile> source = SourceFile.fromPath(path);
                if (source.isPresent()) {
                    files.add(source.get());
                } else {
                    log.warn("Could not extract year/title/volume from {}; skipping", path);
                    skipped.add(path);
                }
            }
        }

        log.info("Found {} markup files ({} skipped)", files.size(), skipped.size());
        return new DiscoveredCorpus(files, skipped);
    }
}
