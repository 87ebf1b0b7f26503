package com.dcruver.regmetrics.domain;

import com.dcruver.regmetrics.io.HierarchyParser;
import com.dcruver.regmetrics.io.ParsedTitle;
import com.dcruver.regmetrics.io.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalRecordBuilderTest {

    private static final String MARKUP = """
        <CFRDOC>
          <PART>
            <HD>PART 1—GENERAL PROVISIONS</HD>
            <SUBPART>
              <HD>Subpart A—Definitions</HD>
              <SECTION><SECTNO>§ 1.1</SECTNO><SUBJECT>Terms.</SUBJECT><P>Words mean things.</P></SECTION>
            </SUBPART>
            <SECTION><SECTNO>§ 1.2</SECTNO><SUBJECT>Applicability.</SUBJECT><P>Applies broadly.</P></SECTION>
            <SECTION><SECTNO>§ 1.3</SECTNO><RESERVED>[Reserved]</RESERVED></SECTION>
          </PART>
        </CFRDOC>
        """;

    private HierarchyParser parser;
    private CanonicalRecordBuilder builder;
    private SourceFile volume1;
    private SourceFile volume2;

    @BeforeEach
    void setUp() {
        parser = new HierarchyParser();
        builder = new CanonicalRecordBuilder();
        volume1 = SourceFile.fromPath(Path.of("CFR-2020-title7-vol1.xml")).orElseThrow();
        volume2 = SourceFile.fromPath(Path.of("CFR-2020-title7-vol2.xml")).orElseThrow();
    }

    @Test
    void testOneRecordPerSection() throws Exception {
        ParsedTitle parsed = parser.parseText(MARKUP);

        List<SectionRecord> records = builder.build(parsed, "2020", "7");

        assertEquals(parsed.sectionCount(), records.size());
        assertEquals(List.of("1.1", "1.2", "1.3"), records.stream().map(SectionRecord::getSectionNumber).toList());

        SectionRecord first = records.get(0);
        assertEquals("2020", first.getYear());
        assertEquals("7", first.getTitleNumber());
        assertEquals("1", first.getPartNumber());
        assertEquals("GENERAL PROVISIONS", first.getPartTitle());
        assertEquals("A", first.getSubpartNumber());
        assertEquals("Terms.", first.getSectionTitle());
        assertEquals("Words mean things.", first.getContent());
        assertEquals(ContentStatus.EXTRACTED, first.getContentStatus());

        assertNull(records.get(1).getSubpartNumber());
    }

    @Test
    void testEmptySectionIsKeptWithEmptyStatus() throws Exception {
        List<SectionRecord> records = builder.build(parser.parseText(MARKUP), "2020", "7");

        SectionRecord reserved = records.get(2);
        assertEquals("", reserved.getContent());
        assertEquals(ContentStatus.EMPTY, reserved.getContentStatus());
        assertTrue(reserved.isEmpty());
    }

    @Test
    void testTitleFileKeepsFirstDuplicate() {
        SectionRecord original = record("1", "1.1", "original");
        SectionRecord duplicate = record("1", "1.1", "duplicate");

        TitleFile titleFile = builder.toTitleFile(volume1, List.of(original, duplicate, record("2", "2.1", "other")));

        assertEquals(2, titleFile.sectionCount());
        assertEquals("original", titleFile.findSection("1", "1.1").orElseThrow().getContent());
        assertEquals("1", titleFile.getVolume());
        assertEquals(List.of(
            new IndexEntry("2020", "7", "1", "1.1"),
            new IndexEntry("2020", "7", "2", "2.1")), titleFile.keys());
    }

    @Test
    void testMergeAddsNewEntriesAndKeepsExisting() {
        TitleFile base = builder.toTitleFile(volume1, List.of(record("1", "1.1", "first volume")));
        TitleFile addition = builder.toTitleFile(volume2, List.of(
            record("1", "1.1", "second volume"),
            record("1", "1.2", "new section"),
            record("2", "2.1", "new part")));

        TitleFile merged = builder.merge(base, addition);

        assertEquals(3, merged.sectionCount());
        assertEquals("first volume", merged.findSection("1", "1.1").orElseThrow().getContent());
        assertEquals("new section", merged.findSection("1", "1.2").orElseThrow().getContent());
        assertEquals("new part", merged.findSection("2", "2.1").orElseThrow().getContent());
        assertEquals("1", merged.getVolume());
        assertEquals(1, base.sectionCount(), "Merge must not modify its inputs");
    }

    private static SectionRecord record(String part, String section, String content) {
        return SectionRecord.builder()
            .year("2020")
            .titleNumber("7")
            .partNumber(part)
            .partTitle("Part " + part)
            .sectionNumber(section)
            .sectionTitle("")
            .content(content)
            .contentStatus(ContentStatus.EXTRACTED)
            .build();
    }
}
