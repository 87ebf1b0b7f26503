package com.dcruver.regmetrics.history;

import com.dcruver.regmetrics.io.HierarchyParser;
import com.dcruver.regmetrics.metrics.ComplexityPolicy;
import com.dcruver.regmetrics.metrics.MetricsCalculator;
import com.dcruver.regmetrics.metrics.MetricsRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VersionHistoryWalkerTest {

    private HierarchyParser parser;
    private MetricsCalculator calculator;

    @BeforeEach
    void setUp() {
        parser = new HierarchyParser();
        calculator = new MetricsCalculator(new ComplexityPolicy());
    }

    @Test
    void testAuthorTotalsAccumulateFromOldest() {
        List<VersionRecord> versions = List.of(
            version(2022, "Third text.", "A", "C"),
            version(2021, "Second text.", "B"),
            version(2020, "First text.", "A"));

        List<MetricsRecord> records = walker(versions).walk();

        assertEquals(3, records.size());
        assertEquals(LocalDate.of(2022, 1, 1), records.get(0).getMetricsDate(), "Walk runs newest first");

        MetricsRecord v1 = byYear(records, 2020);
        MetricsRecord v2 = byYear(records, 2021);
        MetricsRecord v3 = byYear(records, 2022);
        assertEquals(1, v1.getTotalAuthors());
        assertEquals(2, v2.getTotalAuthors());
        assertEquals(3, v3.getTotalAuthors());
        assertEquals(1, v1.getRevisionAuthors());
        assertEquals(1, v2.getRevisionAuthors());
        assertEquals(2, v3.getRevisionAuthors());
    }

    @Test
    void testTotalsAreMonotonicInDateOrder() {
        List<VersionRecord> versions = new ArrayList<>();
        String[][] authors = {{"A"}, {"A"}, {"B", "C"}, {}, {"A", "D"}, {"E"}, {"C"}};
        for (int i = authors.length - 1; i >= 0; i--) {
            versions.add(version(2010 + i, "Version " + i + " text.", authors[i]));
        }

        List<MetricsRecord> records = new ArrayList<>(walker(versions).walk());
        records.sort(Comparator.comparing(MetricsRecord::getMetricsDate));

        for (int i = 1; i < records.size(); i++) {
            assertTrue(records.get(i - 1).getTotalAuthors() <= records.get(i).getTotalAuthors());
        }
        assertEquals(5, records.get(records.size() - 1).getTotalAuthors());
    }

    @Test
    void testOutOfOrderInputIsResorted() {
        List<VersionRecord> versions = List.of(
            version(2020, "First text.", "A"),
            version(2022, "Third text.", "A", "C"),
            version(2021, "Second text.", "B"));

        List<MetricsRecord> records = walker(versions).walk();

        assertEquals(List.of(2022, 2021, 2020), records.stream().map(r -> r.getMetricsDate().getYear()).toList());
        assertEquals(3, byYear(records, 2022).getTotalAuthors());
    }

    @Test
    void testMalformedVersionsAreSkippedAndContributeNoAuthors() {
        VersionRecord undated = VersionRecord.builder().rawText("No date.").revisionAuthorIds(Set.of("X")).build();
        VersionRecord textless = VersionRecord.builder()
            .versionDate(LocalDate.of(2019, 1, 1)).revisionAuthorIds(Set.of("Y")).build();
        List<VersionRecord> versions = Arrays.asList(
            version(2021, "Second text.", "B"),
            null,
            undated,
            version(2021, "Duplicate date.", "Z"),
            version(2020, "First text.", "A"),
            textless);

        VersionHistoryWalker walker = walker(versions);
        List<MetricsRecord> records = walker.walk();

        assertEquals(2, records.size());
        assertEquals(4, walker.skipped());
        assertEquals(2, byYear(records, 2021).getTotalAuthors());
        assertEquals("Second text.", byYear(records, 2021).getContentSnapshot());
    }

    @Test
    void testEmptyVersionStillProducesRecord() {
        List<MetricsRecord> records = walker(List.of(version(2020, "", "A"))).walk();

        assertEquals(1, records.size());
        assertEquals(0, records.get(0).getWordCount());
        assertEquals(1, records.get(0).getTotalAuthors());
    }

    @Test
    void testMarkupVersionIsMeasuredByStructureAndBodyText() {
        String markup = """
            <PART><HD>PART 1—General</HD>
              <SUBPART><HD>Subpart A—Scope</HD>
                <SECTION><SECTNO>§ 1.1</SECTNO><P>One sentence here.</P></SECTION>
              </SUBPART>
              <SECTION><SECTNO>§ 1.2</SECTNO><P>Two.</P><CITA>61 FR 100</CITA></SECTION>
            </PART>
            """;

        MetricsRecord record = walker(List.of(version(2020, markup, "A"))).walk().get(0);

        assertEquals(2, record.getSectionCount());
        assertEquals(1, record.getSubpartCount());
        assertEquals(4, record.getWordCount());
        assertEquals(2, record.getSentenceCount());
        assertEquals(2, record.getParagraphCount());
        assertEquals("One sentence here.\n\nTwo.", record.getContentSnapshot());
    }

    @Test
    void testStateMachine() {
        VersionHistoryWalker walker = walker(List.of(
            version(2021, "Second text.", "B"),
            version(2020, "First text.", "A")));

        assertEquals(WalkState.AT_LATEST, walker.getState());

        Optional<MetricsRecord> first = walker.step();
        assertTrue(first.isPresent());
        assertEquals(2021, first.get().getMetricsDate().getYear());
        assertEquals(WalkState.WALKING, walker.getState());

        Optional<MetricsRecord> second = walker.step();
        assertTrue(second.isPresent());
        assertEquals(WalkState.DONE, walker.getState());

        assertTrue(walker.step().isEmpty());
        assertEquals(2, walker.getEmitted());
    }

    @Test
    void testEmptyHistoryFinishesImmediately() {
        VersionHistoryWalker walker = walker(List.of());

        assertTrue(walker.walk().isEmpty());
        assertEquals(WalkState.DONE, walker.getState());
    }

    private VersionHistoryWalker walker(List<VersionRecord> versions) {
        return new VersionHistoryWalker("doc-1", versions, parser, calculator);
    }

    private static VersionRecord version(int year, String text, String... authors) {
        return VersionRecord.builder()
            .documentId("doc-1")
            .versionDate(LocalDate.of(year, 1, 1))
            .rawText(text)
            .revisionAuthorIds(Set.of(authors))
            .build();
    }

    private static MetricsRecord byYear(List<MetricsRecord> records, int year) {
        return records.stream()
            .filter(record -> record.getMetricsDate().getYear() == year)
            .findFirst()
            .orElseThrow();
    }
}
