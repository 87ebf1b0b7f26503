package com.dcruver.regmetrics.app;

import com.dcruver.regmetrics.domain.SectionRecord;
import com.dcruver.regmetrics.history.HistoryMetricsService;
import com.dcruver.regmetrics.history.HistoryRunSummary;
import com.dcruver.regmetrics.history.JdbcMetricsSink;
import com.dcruver.regmetrics.history.YearlyMetrics;
import com.dcruver.regmetrics.ingest.ConversionSummary;
import com.dcruver.regmetrics.ingest.IngestionCoordinator;
import com.dcruver.regmetrics.ingest.UnitResult;
import com.dcruver.regmetrics.metrics.MetricsRecord;
import com.dcruver.regmetrics.reporting.ConversionReportWriter;
import com.dcruver.regmetrics.store.SectionLookup;
import com.dcruver.regmetrics.store.StoreIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Spring Shell commands for converting the corpus, looking up sections and computing
 * and browsing historical metrics.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class RegMetricsShellCommands {

    private final IngestionCoordinator coordinator;
    private final ConversionReportWriter reportWriter;
    private final SectionLookup sectionLookup;
    private final HistoryMetricsService historyMetrics;
    private final JdbcMetricsSink metricsStore;

    @Value("${regmetrics.input-dir}")
    private String inputDir;

    @ShellMethod(key = "convert", value = "Convert bulk markup files into the indexed store")
    public String convert(@ShellOption(defaultValue = ShellOption.NULL, help = "Input directory") String input) {
        Path source = Path.of(input != null ? input : inputDir);
        log.info("Converting corpus at {}", source);

        try {
            ConversionSummary summary = coordinator.convert(source);
            sectionLookup.reload();
            Path report = reportWriter.write(summary);

            StringBuilder result = new StringBuilder();
            result.append("Conversion completed.\n\n");
            result.append(String.format("- Units succeeded: %d\n", summary.getSucceeded().size()));
            result.append(String.format("- Units failed: %d\n", summary.getFailed().size()));
            result.append(String.format("- File failures: %d\n", summary.getFileFailures().size()));
            result.append(String.format("- Skipped files: %d\n", summary.getSkippedFiles().size()));
            result.append(String.format("- Indexed sections: %d\n", summary.getIndexedKeys()));
            for (UnitResult failed : summary.getFailed()) {
                result.append(String.format("  ! %s: %s\n", failed.getUnitKey(), failed.getFailureReason()));
            }
            result.append("\nReport: ").append(report).append("\n");
            return result.toString();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Conversion interrupted");
            return "Conversion interrupted; the index was not built.";
        } catch (Exception e) {
            log.error("Conversion failed", e);
            return "Conversion failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "lookup", value = "Show one section by year, title, part and section")
    public String lookup(
        @ShellOption(help = "Year") String year,
        @ShellOption(help = "Title number") String title,
        @ShellOption(help = "Part number") String part,
        @ShellOption(help = "Section number") String section
    ) {
        try {
            Optional<SectionRecord> record = sectionLookup.lookup(year, title, part, section);
            if (record.isPresent()) {
                return formatSection(record.get());
            }
            return notFound(sectionLookup.index(), year, title, part, section);

        } catch (NoSuchFileException e) {
            return "No index found. Run 'convert' first.";
        } catch (Exception e) {
            log.error("Lookup failed", e);
            return "Lookup failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "store status", value = "Show what the published index covers")
    public String storeStatus() {
        try {
            StoreIndex index = sectionLookup.index();

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Index: %d sections\n\n", index.size()));
            for (String year : index.years()) {
                sb.append(year).append(": titles ").append(String.join(", ", index.titles(year))).append("\n");
            }
            return sb.toString();

        } catch (NoSuchFileException e) {
            return "No index found. Run 'convert' first.";
        } catch (Exception e) {
            log.error("Failed to read store index", e);
            return "Failed to read store index: " + e.getMessage();
        }
    }

    @ShellMethod(key = "history metrics", value = "Compute historical metrics for every document")
    public String historyMetrics(
        @ShellOption(defaultValue = "false", help = "Recompute records that are already stored") boolean recompute
    ) {
        log.info("Computing historical metrics...");

        try {
            HistoryRunSummary summary = historyMetrics.computeAll(recompute);

            StringBuilder sb = new StringBuilder();
            sb.append("Historical metrics completed.\n\n");
            sb.append(String.format("- Documents: %d\n", summary.getDocuments()));
            sb.append(String.format("- Records: %d\n", summary.getRecords()));
            sb.append(String.format("- Already stored: %d\n", summary.getAlreadyStored()));
            sb.append(String.format("- Skipped versions: %d\n", summary.getSkippedVersions()));
            sb.append(String.format("- Failed documents: %d\n", summary.getFailedDocuments().size()));
            summary.getFailedDocuments().forEach(id -> sb.append("  ! ").append(id).append("\n"));
            return sb.toString();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Historical metrics interrupted");
            return "Historical metrics interrupted.";
        } catch (Exception e) {
            log.error("Historical metrics failed", e);
            return "Historical metrics failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "history show", value = "Show the stored metrics of one document")
    public String historyShow(
        @ShellOption(help = "Document id") String document,
        @ShellOption(defaultValue = ShellOption.NULL, help = "First date, yyyy-MM-dd") String from,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Last date, yyyy-MM-dd") String to
    ) {
        try {
            List<MetricsRecord> records = metricsStore.findByDocument(document,
                from != null ? LocalDate.parse(from) : null,
                to != null ? LocalDate.parse(to) : null);
            if (records.isEmpty()) {
                return "No metrics stored for " + document + ".";
            }

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Metrics for %s: %d records\n\n", document, records.size()));
            sb.append(String.format("%-10s %7s %6s %8s %7s %10s %11s %10s %8s\n",
                "date", "words", "sents", "sections", "authors", "complexity", "readability", "simplicity", "combined"));
            for (MetricsRecord record : records) {
                sb.append(String.format("%-10s %7d %6d %8d %7d %10.3f %11.1f %10.3f %8.1f\n",
                    record.getMetricsDate(), record.getWordCount(), record.getSentenceCount(),
                    record.getSectionCount(), record.getTotalAuthors(), record.getLanguageComplexityScore(),
                    record.getReadabilityScore(), record.getSimplicityScore(), record.getCombinedReadabilityScore()));
            }
            return sb.toString();

        } catch (DateTimeParseException e) {
            return "Invalid date: " + e.getParsedString() + " (expected yyyy-MM-dd)";
        } catch (Exception e) {
            log.error("Failed to read metrics for {}", document, e);
            return "Failed to read metrics: " + e.getMessage();
        }
    }

    @ShellMethod(key = "history stats", value = "Show per-year averages of the stored metrics")
    public String historyStats() {
        try {
            List<YearlyMetrics> years = metricsStore.yearlyAverages();
            if (years.isEmpty()) {
                return "No metrics stored. Run 'history metrics' first.";
            }

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Stored metrics: %d records\n\n", metricsStore.count()));
            sb.append(String.format("%-4s %7s %9s %9s %10s %11s %10s %8s\n",
                "year", "records", "documents", "avg words", "complexity", "readability", "simplicity", "combined"));
            for (YearlyMetrics year : years) {
                sb.append(String.format("%-4s %7d %9d %9.1f %10.3f %11.1f %10.3f %8.1f\n",
                    year.getYear(), year.getRecords(), year.getDocuments(), year.getAverageWordCount(),
                    year.getAverageComplexity(), year.getAverageReadability(), year.getAverageSimplicity(),
                    year.getAverageCombinedReadability()));
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Failed to read metrics statistics", e);
            return "Failed to read metrics statistics: " + e.getMessage();
        }
    }

    private String formatSection(SectionRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Title %s, Part %s", record.getTitleNumber(), record.getPartNumber()));
        if (record.getPartTitle() != null && !record.getPartTitle().isEmpty()) {
            sb.append(" - ").append(record.getPartTitle());
        }
        sb.append("\n");
        if (record.getSubpartNumber() != null) {
            sb.append("Subpart ").append(record.getSubpartNumber()).append("\n");
        }
        sb.append("§ ").append(record.getSectionNumber());
        if (record.getSectionTitle() != null && !record.getSectionTitle().isEmpty()) {
            sb.append(" ").append(record.getSectionTitle());
        }
        sb.append(" (").append(record.getYear()).append(")\n\n");
        sb.append(record.isEmpty() ? "[no content]" : record.getContent()).append("\n");
        return sb.toString();
    }

    /**
     * Point at the level where the key stopped matching
     */
    private String notFound(StoreIndex index, String year, String title, String part, String section) {
        String missing = String.format("Section %s/%s/%s/%s not found.", year, title, part, section);

        if (!index.years().contains(year)) {
            return missing + "\nAvailable years: " + join(index.years());
        }
        if (!index.titles(year).contains(title)) {
            return missing + "\nAvailable titles for " + year + ": " + join(index.titles(year));
        }
        if (!index.parts(year, title).contains(part)) {
            return missing + "\nAvailable parts in title " + title + ": " + join(index.parts(year, title));
        }
        return missing + "\nAvailable sections in part " + part + ": " + String.join(", ", index.sections(year, title, part));
    }

    private static String join(Set<String> values) {
        return String.join(", ", values);
    }
}
