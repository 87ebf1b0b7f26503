package com.dcruver.regmetrics.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyParserTest {

    static final String CFR_SAMPLE = """
        <CFRDOC>
          <TITLEHD>Title 7—Agriculture</TITLEHD>
          <PART>
            <HD SOURCE="HED">PART 1—ADMINISTRATIVE REGULATIONS</HD>
            <AUTH><HD>Authority:</HD><P>5 U.S.C. 301</P></AUTH>
            <SUBPART>
              <HD SOURCE="HED">Subpart A—General</HD>
              <SECTION>
                <SECTNO>§ 1.1</SECTNO>
                <SUBJECT>Purpose.</SUBJECT>
                <P>This part applies.</P>
                <P>Second paragraph.</P>
                <CITA>[61 FR 100, Jan. 2, 1996]</CITA>
              </SECTION>
            </SUBPART>
            <SECTION>
              <SECTNO>§ 1.2</SECTNO>
              <SUBJECT>Scope.</SUBJECT>
              <P>Text two.</P>
            </SECTION>
            <SECTION>
              <SECTNO>§ 1.3</SECTNO>
              <RESERVED>[Reserved]</RESERVED>
            </SECTION>
          </PART>
        </CFRDOC>
        """;

    private HierarchyParser parser;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        parser = new HierarchyParser();
    }

    @Test
    void testCitationTextIsExcluded() throws Exception {
        ParsedTitle parsed = parser.parseText(
            "<PART>1<SECTION>1.1<CITATION>Source: 61 FR 100</CITATION>This part applies to all regulations.</SECTION></PART>");

        assertEquals(1, parsed.parts().size());
        MarkupNode part = parsed.parts().get(0);
        assertEquals("1", part.getNumber());

        List<MarkupNode> sections = parsed.sections();
        assertEquals(1, sections.size());
        assertEquals("1.1", sections.get(0).getNumber());
        assertEquals("This part applies to all regulations.", sections.get(0).getText());
        assertEquals(1, parsed.getExcludedCount());
    }

    @Test
    void testParsesCfrStyleMarkup() throws Exception {
        Path file = tempDir.resolve("CFR-2020-title7-vol1.xml");
        Files.writeString(file, CFR_SAMPLE);

        ParsedTitle parsed = parser.parse(SourceFile.fromPath(file).orElseThrow());

        assertEquals("7", parsed.getRoot().getNumber());
        assertEquals("Title 7—Agriculture", parsed.getRoot().getHeading());
        assertTrue(parsed.getAnomalies().isEmpty());

        MarkupNode part = parsed.parts().get(0);
        assertEquals("1", part.getNumber());
        assertEquals("ADMINISTRATIVE REGULATIONS", part.getHeading());

        MarkupNode subpart = part.childrenOfKind(NodeKind.SUBPART).get(0);
        assertEquals("A", subpart.getNumber());
        assertEquals("General", subpart.getHeading());

        List<MarkupNode> sections = parsed.sections();
        assertEquals(3, sections.size());
        assertEquals(3, parsed.sectionCount());
        assertEquals(1, parsed.subpartCount());

        MarkupNode first = sections.get(0);
        assertEquals("1.1", first.getNumber());
        assertEquals("Purpose.", first.getHeading());
        assertEquals("This part applies.\n\nSecond paragraph.", first.getText());
        assertFalse(first.getText().contains("61 FR"), "Citation must not leak into content");

        assertEquals("1.2", sections.get(1).getNumber());
        assertEquals("Text two.", sections.get(1).getText());

        MarkupNode reserved = sections.get(2);
        assertEquals("[Reserved]", reserved.getHeading());
        assertFalse(reserved.hasText());
    }

    @Test
    void testAuthorityIsNotPartOfPartText() throws Exception {
        ParsedTitle parsed = parser.parseText(CFR_SAMPLE);

        assertFalse(parsed.bodyText().contains("5 U.S.C. 301"));
        assertFalse(parsed.bodyText().contains("Authority"));
    }

    @Test
    void testSectionOutsidePartGoesToUnassignedPart() throws Exception {
        ParsedTitle parsed = parser.parseText("""
            <DOC>
              <SECTION><SECTNO>§ 5.1</SECTNO><P>Orphan text.</P></SECTION>
              <PART>
                <HD>PART 5—RULES</HD>
                <SECTION><SECTNO>§ 5.2</SECTNO><P>Owned text.</P></SECTION>
              </PART>
            </DOC>
            """);

        List<MarkupNode> parts = parsed.parts();
        assertEquals(2, parts.size());
        assertEquals(MarkupNode.UNASSIGNED, parts.get(0).getNumber());
        assertTrue(parts.get(0).isSynthetic());
        assertEquals("5.1", parts.get(0).getChildren().get(0).getNumber());
        assertEquals("5", parts.get(1).getNumber());

        assertEquals(1, parsed.getAnomalies().size());
        assertTrue(parsed.getAnomalies().get(0).contains("5.1"));
    }

    @Test
    void testNestedPartIsHoistedToTitle() throws Exception {
        ParsedTitle parsed = parser.parseText("""
            <PART>
              <HD>PART 1—OUTER</HD>
              <SECTION><SECTNO>§ 1.1</SECTNO><P>Outer text.</P></SECTION>
              <PART>
                <HD>PART 2—INNER</HD>
                <SECTION><SECTNO>§ 2.1</SECTNO><P>Inner text.</P></SECTION>
              </PART>
            </PART>
            """);

        List<MarkupNode> parts = parsed.parts();
        assertEquals(2, parts.size());
        assertEquals("1", parts.get(0).getNumber());
        assertEquals("2", parts.get(1).getNumber());
        assertEquals("2.1", parts.get(1).childrenOfKind(NodeKind.SECTION).get(0).getNumber());
        assertEquals(List.of("1.1"), parts.get(0).childrenOfKind(NodeKind.SECTION).stream().map(MarkupNode::getNumber).toList());
        assertFalse(parts.get(0).getText().contains("Inner"));

        assertEquals(1, parsed.getAnomalies().size());
        assertTrue(parsed.getAnomalies().get(0).contains("PART 2 nested inside PART 1"));
    }

    @Test
    void testSectionInsideSectionIsKeptAsSibling() throws Exception {
        ParsedTitle parsed = parser.parseText("""
            <PART>
              <HD>PART 4—FILINGS</HD>
              <SECTION>
                <SECTNO>§ 4.1</SECTNO>
                <P>Outer body.</P>
                <SECTION><SECTNO>§ 4.2</SECTNO><P>Inner body.</P></SECTION>
              </SECTION>
            </PART>
            """);

        List<MarkupNode> sections = parsed.sections();
        assertEquals(2, sections.size());
        assertEquals("4.1", sections.get(0).getNumber());
        assertEquals("Outer body.", sections.get(0).getText());
        assertEquals("4.2", sections.get(1).getNumber());
        assertEquals("Inner body.", sections.get(1).getText());
        assertEquals(2, parsed.parts().get(0).childrenOfKind(NodeKind.SECTION).size());

        assertEquals(1, parsed.getAnomalies().size());
        assertTrue(parsed.getAnomalies().get(0).contains("SECTION 4.2 nested inside SECTION 4.1"));
    }

    @Test
    void testBodyStartingWithNumberIsNotTakenAsSectionNumber() throws Exception {
        ParsedTitle parsed = parser.parseText("""
            <PART>
              <HD>PART 3—DEADLINES</HD>
              <SECTION><SUBJECT>Deadline.</SUBJECT><P>30 days after notice the filing is due.</P></SECTION>
            </PART>
            """);

        MarkupNode section = parsed.sections().get(0);
        assertEquals("unknown", section.getNumber());
        assertEquals("Deadline.", section.getHeading());
        assertEquals("30 days after notice the filing is due.", section.getText());
    }

    @Test
    void testHonorsEncodingDeclaredInProlog() throws Exception {
        Path file = tempDir.resolve("CFR-2020-title8-vol1.xml");
        String markup = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?>"
            + "<CFRDOC><PART><HD>PART 8-FEES</HD>"
            + "<SECTION><SECTNO>§ 8.1</SECTNO><P>Café permits are issued under § 8.2.</P></SECTION>"
            + "</PART></CFRDOC>";
        Files.writeString(file, markup, StandardCharsets.ISO_8859_1);

        ParsedTitle parsed = parser.parse(SourceFile.fromPath(file).orElseThrow());

        MarkupNode section = parsed.sections().get(0);
        assertEquals("8.1", section.getNumber());
        assertEquals("Café permits are issued under § 8.2.", section.getText());
    }

    @Test
    void testOneRecordPerSectionNode() throws Exception {
        StringBuilder markup = new StringBuilder("<PART><HD>PART 9—MANY</HD>");
        for (int i = 1; i <= 25; i++) {
            markup.append("<SECTION><SECTNO>§ 9.").append(i).append("</SECTNO><P>Body ").append(i).append(".</P></SECTION>");
        }
        markup.append("<NOTE><SECTION><SECTNO>§ 9.99</SECTNO></SECTION></NOTE></PART>");

        ParsedTitle parsed = parser.parseText(markup.toString());

        assertEquals(25, parsed.sectionCount());
        assertEquals("9.25", parsed.sections().get(24).getNumber());
    }

    @Test
    void testToleratesUnclosedTags() throws Exception {
        ParsedTitle parsed = parser.parseText(
            "<PART><HD>PART 2—LOOSE</HD><SECTION><SECTNO>§ 2.1</SECTNO><P>Never closed.");

        assertEquals(1, parsed.sectionCount());
        assertEquals("Never closed.", parsed.sections().get(0).getText());
    }

    @Test
    void testEmptyFileIsAParseFailure() throws Exception {
        Path file = tempDir.resolve("CFR-2020-title3-vol1.xml");
        Files.writeString(file, "   \n");

        SourceFile source = SourceFile.fromPath(file).orElseThrow();
        assertThrows(MarkupParseException.class, () -> parser.parse(source));
    }

    @Test
    void testPlainTextFileIsAParseFailure() throws Exception {
        Path file = tempDir.resolve("CFR-2020-title3-vol2.xml");
        Files.writeString(file, "no markup at all");

        SourceFile source = SourceFile.fromPath(file).orElseThrow();
        assertThrows(MarkupParseException.class, () -> parser.parse(source));
    }

    @Test
    void testPlainVersionTextBecomesTitleText() throws Exception {
        ParsedTitle parsed = parser.parseText("Just some words.");

        assertTrue(parsed.parts().isEmpty());
        assertEquals("Just some words.", parsed.bodyText());
    }

    @Test
    void testMissingVersionTextIsRejected() {
        assertThrows(MarkupParseException.class, () -> parser.parseText(null));
    }

    @Test
    void testCleanNumber() {
        assertEquals("1.1", HierarchyParser.cleanNumber("§ 1.1"));
        assertEquals("12", HierarchyParser.cleanNumber("PART 12"));
        assertEquals("B", HierarchyParser.cleanNumber("Subpart B"));
        assertNull(HierarchyParser.cleanNumber("  "));
    }
}
