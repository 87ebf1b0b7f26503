package com.dcruver.regmetrics.history;

import com.dcruver.regmetrics.io.HierarchyParser;
import com.dcruver.regmetrics.io.MarkupParseException;
import com.dcruver.regmetrics.io.ParsedTitle;
import com.dcruver.regmetrics.metrics.DocumentStructure;
import com.dcruver.regmetrics.metrics.MetricsCalculator;
import com.dcruver.regmetrics.metrics.MetricsRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks one document's versions from newest to oldest, emitting a MetricsRecord per
 * version.
 *
 * Author totals are cumulative from the oldest version forward, so they cannot be known
 * while walking backward. On the first step the versions are folded oldest to newest
 * once to fix each version's total; the backward walk then reads those totals.
 *
 * Not thread-safe. One walker per document.
 */
@Slf4j
public class VersionHistoryWalker {

    private final String documentId;
    private final HierarchyParser parser;
    private final MetricsCalculator calculator;
    private final List<VersionRecord> versions;   // newest first, validated
    private int skipped;

    private WalkState state = WalkState.AT_LATEST;
    private final List<Measured> pending = new ArrayList<>();
    private int cursor;
    private int emitted;

    public VersionHistoryWalker(String documentId, List<VersionRecord> versions,
                                HierarchyParser parser, MetricsCalculator calculator) {
        this.documentId = documentId;
        this.parser = parser;
        this.calculator = calculator;
        this.versions = validate(versions != null ? versions : List.of());
    }

    public WalkState getState() {
        return state;
    }

    public String getDocumentId() {
        return documentId;
    }

    public int getEmitted() {
        return emitted;
    }

    /**
     * Versions dropped so far: malformed, undated, textless, duplicate or unparsable
     */
    public int skipped() {
        return skipped;
    }

    /**
     * Process the next version, newest first. Empty once the walk is DONE.
     */
    public Optional<MetricsRecord> step() {
        if (state == WalkState.AT_LATEST) {
            foldAuthors();
            state = WalkState.WALKING;
        }
        if (state == WalkState.DONE) {
            return Optional.empty();
        }

        if (cursor >= pending.size()) {
            finish();
            return Optional.empty();
        }

        Measured next = pending.get(cursor++);
        MetricsRecord record = calculator.compute(documentId, next.date, next.text, next.structure,
            next.accumulatedAuthors, next.revisionAuthors);
        emitted++;

        if (cursor >= pending.size()) {
            finish();
        }
        return Optional.of(record);
    }

    /**
     * Drive the walk to DONE, returning records newest first
     */
    public List<MetricsRecord> walk() {
        List<MetricsRecord> records = new ArrayList<>();
        while (state != WalkState.DONE) {
            step().ifPresent(records::add);
        }
        return records;
    }

    private void finish() {
        state = WalkState.DONE;
        log.info("Finished history walk for {}: {} versions measured, {} skipped", documentId, pending.size(), skipped);
    }

    private List<VersionRecord> validate(List<VersionRecord> input) {
        List<VersionRecord> valid = new ArrayList<>();
        Set<LocalDate> seenDates = new HashSet<>();

        for (int i = 0; i < input.size(); i++) {
            VersionRecord version = input.get(i);
            if (version == null) {
                skip("version #" + i + " is missing");
            } else if (version.getVersionDate() == null) {
                skip("version #" + i + " has no date");
            } else if (version.getRawText() == null) {
                skip("version " + version.getVersionDate() + " has no text");
            } else if (!seenDates.add(version.getVersionDate())) {
                skip("version " + version.getVersionDate() + " is a duplicate date");
            } else {
                valid.add(version);
            }
        }

        Comparator<VersionRecord> newestFirst = Comparator.comparing(VersionRecord::getVersionDate).reversed();
        for (int i = 1; i < valid.size(); i++) {
            if (newestFirst.compare(valid.get(i - 1), valid.get(i)) > 0) {
                log.warn("Versions of {} are not ordered newest first; re-sorting", documentId);
                valid.sort(newestFirst);
                break;
            }
        }
        return valid;
    }

    /**
     * First pass, oldest to newest: parse each version and fix its cumulative author set.
     * A version that fails to parse is skipped and contributes no authors.
     */
    private void foldAuthors() {
        Map<LocalDate, Measured> measured = new HashMap<>();
        Set<String> accumulated = new HashSet<>();

        for (int i = versions.size() - 1; i >= 0; i--) {
            VersionRecord version = versions.get(i);
            ParsedTitle parsed;
            try {
                parsed = parser.parseText(version.getRawText());
            } catch (MarkupParseException e) {
                skip("version " + version.getVersionDate() + " could not be parsed: " + e.getMessage());
                continue;
            }

            Set<String> revisionAuthors = version.getRevisionAuthorIds() == null ? Set.of()
                : version.getRevisionAuthorIds().stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
            accumulated.addAll(revisionAuthors);

            measured.put(version.getVersionDate(), new Measured(
                version.getVersionDate(),
                measuredText(version.getRawText(), parsed),
                new DocumentStructure(parsed.sectionCount(), parsed.subpartCount()),
                Set.copyOf(accumulated),
                revisionAuthors));
        }

        for (VersionRecord version : versions) {
            Measured entry = measured.get(version.getVersionDate());
            if (entry != null) {
                pending.add(entry);
            }
        }
        log.debug("Folded authors for {}: {} distinct across {} versions", documentId, accumulated.size(), pending.size());
    }

    /**
     * Plain text is measured as written; markup is measured by its extracted body text
     */
    private static String measuredText(String rawText, ParsedTitle parsed) {
        return rawText.indexOf('<') < 0 ? rawText.strip() : parsed.bodyText();
    }

    private void skip(String reason) {
        skipped++;
        log.warn("Skipping in history of {}: {}", documentId, reason);
    }

    private static final class Measured {
        private final LocalDate date;
        private final String text;
        private final DocumentStructure structure;
        private final Set<String> accumulatedAuthors;
        private final Set<String> revisionAuthors;

        private Measured(LocalDate date, String text, DocumentStructure structure,
                         Set<String> accumulatedAuthors, Set<String> revisionAuthors) {
            this.date = date;
            this.text = text;
            this.structure = structure;
            this.accumulatedAuthors = accumulatedAuthors;
            this.revisionAuthors = revisionAuthors;
        }
    }
}
