package com.dcruver.regmetrics.reporting;

import com.dcruver.regmetrics.ingest.ConversionSummary;
import com.dcruver.regmetrics.ingest.FileFailure;
import com.dcruver.regmetrics.ingest.UnitResult;
import com.dcruver.regmetrics.store.IndexedPart;
import com.dcruver.regmetrics.store.WrittenTitle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConversionReportWriterTest {

    @TempDir
    Path reportDir;

    @Test
    void testWritesReportWithSucceededAndFailedUnits() throws Exception {
        WrittenTitle written = new WrittenTitle("2020", "7", "2020/title_7.json", Map.of(
            "1", IndexedPart.builder().partTitle("General").sections(List.of("1.1", "1.2")).build()));

        ConversionSummary summary = ConversionSummary.builder()
            .startedAt(Instant.parse("2024-03-05T10:15:30Z"))
            .elapsed(Duration.ofMillis(1500))
            .workers(4)
            .succeeded(List.of(UnitResult.builder()
                .unitKey("2020/7").fileCount(2).succeeded(true).written(written).writeAttempts(1)
                .fileFailures(List.of()).build()))
            .failed(List.of(UnitResult.builder()
                .unitKey("2020/50").fileCount(1).succeeded(false).failureReason("no parsable files")
                .fileFailures(List.of()).build()))
            .fileFailures(List.of(new FileFailure(Path.of("in", "CFR-2020-title50-vol1.xml"), "document is empty")))
            .skippedFiles(List.of(Path.of("in", "readme.xml")))
            .indexedKeys(2)
            .build();

        Path report = new ConversionReportWriter(reportDir.toString()).write(summary);

        assertEquals("conversion-report-20240305-101530.txt", report.getFileName().toString());
        String content = Files.readString(report);
        assertTrue(content.contains("Units: 2 (1 succeeded, 1 failed)"));
        assertTrue(content.contains("- 2020/7: 2 files, 2 sections -> 2020/title_7.json"));
        assertTrue(content.contains("- 2020/50: no parsable files"));
        assertTrue(content.contains("CFR-2020-title50-vol1.xml: document is empty"));
        assertTrue(content.contains("readme.xml"));
    }
}
