package com.dcruver.regmetrics.reporting;

import com.dcruver.regmetrics.ingest.ConversionSummary;
import com.dcruver.regmetrics.ingest.FileFailure;
import com.dcruver.regmetrics.ingest.UnitResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes a plain-text report of a conversion run.
 */
@Component
@Slf4j
public class ConversionReportWriter {

    private static final DateTimeFormatter FILE_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final Path reportDir;

    public ConversionReportWriter(@Value("${regmetrics.report-dir}") String reportDir) {
        this.reportDir = Path.of(reportDir).toAbsolutePath().normalize();
    }

    /**
     * Generate and save the report for one run
     */
    public Path write(ConversionSummary summary) throws IOException {
        Files.createDirectories(reportDir);
        Path reportPath = reportDir.resolve("conversion-report-" + FILE_STAMP.format(summary.getStartedAt()) + ".txt");

        Files.writeString(reportPath, render(summary));
        log.info("Generated conversion report: {}", reportPath);

        return reportPath;
    }

    public String render(ConversionSummary summary) {
        StringBuilder sb = new StringBuilder();

        sb.append("Conversion Report - ").append(summary.getStartedAt()).append("\n\n");

        sb.append("Summary\n");
        sb.append(String.format("- Units: %d (%d succeeded, %d failed)\n",
            summary.totalUnits(), summary.getSucceeded().size(), summary.getFailed().size()));
        sb.append(String.format("- Sections written: %d\n", summary.sectionCount()));
        sb.append(String.format("- Indexed keys: %d\n", summary.getIndexedKeys()));
        sb.append(String.format("- Workers: %d\n", summary.getWorkers()));
        sb.append(String.format("- Elapsed: %.1f s\n\n", summary.getElapsed().toMillis() / 1000.0));

        sb.append("Succeeded units\n");
        if (summary.getSucceeded().isEmpty()) {
            sb.append("None.\n");
        }
        for (UnitResult unit : summary.getSucceeded()) {
            sb.append(String.format("- %s: %d files, %d sections -> %s\n",
                unit.getUnitKey(), unit.getFileCount(), unit.sectionCount(), unit.getWritten().getLocation()));
        }
        sb.append("\n");

        sb.append("Failed units\n");
        if (summary.getFailed().isEmpty()) {
            sb.append("None.\n");
        }
        for (UnitResult unit : summary.getFailed()) {
            sb.append(String.format("- %s: %s\n", unit.getUnitKey(), unit.getFailureReason()));
        }
        sb.append("\n");

        appendFileFailures(sb, summary.getFileFailures());

        sb.append("Skipped files (unrecognized names)\n");
        if (summary.getSkippedFiles().isEmpty()) {
            sb.append("None.\n");
        }
        summary.getSkippedFiles().forEach(path -> sb.append("- ").append(path).append("\n"));

        return sb.toString();
    }

    private static void appendFileFailures(StringBuilder sb, List<FileFailure> failures) {
        sb.append("File failures\n");
        if (failures.isEmpty()) {
            sb.append("None.\n");
        }
        for (FileFailure failure : failures) {
            sb.append(String.format("- %s: %s\n", failure.getPath().getFileName(), failure.getMessage()));
        }
        sb.append("\n");
    }
}
