package com.dcruver.regmetrics.io;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses bulk regulatory markup into a TITLE → PART → SUBPART → SECTION tree.
 *
 * Citation, note and editorial subtrees are dropped. Parsing is lenient: unclosed or
 * misnested tags are repaired by the XML tree builder, and structural nodes found outside
 * a PART are attached to a synthetic "unassigned" part instead of failing the file.
 */
@Component
@Slf4j
public class HierarchyParser {

    private static final Set<String> EXCLUDED_TAGS = Set.of(
        "CITA", "CITE", "CITATION", "FTNT", "FTREF", "NOTE", "NOTES", "EDNOTE", "EDITORIAL",
        "AUTH", "SOURCE", "SECAUTH", "EFFDNOT", "PRTPAGE", "CONTENTS", "EAR", "FMTR", "BMTR"
    );
    private static final Set<String> STRUCTURAL_TAGS = Set.of("PART", "SUBPART", "SECTION");
    private static final Set<String> LABEL_TAGS = Set.of("PARTNO", "SECTNO", "SUBJECT", "HD", "RESERVED");
    private static final Set<String> BLOCK_TAGS = Set.of(
        "P", "FP", "PARA", "PSPACE", "EXTRACT", "HD", "GPOTABLE", "ROW", "LI", "APPENDIX"
    );

    private static final String NUMBER = "\\d+[A-Za-z]?(?:[.\\-–]\\d+[A-Za-z]?)*";
    private static final Pattern LEADING_NUMBER =
        Pattern.compile("^(?:§+\\s*|(?i:PART)\\s+)?(" + NUMBER + ")(?=\\s|$|[—–])");
    private static final Pattern LEADING_SUBPART =
        Pattern.compile("^(?:(?i:SUBPART)\\s+)?([A-Z]{1,3}|" + NUMBER + ")(?=\\s*[—–-]|\\s*$|\\n)");
    private static final Pattern PART_HEADING =
        Pattern.compile("^PART\\s+(\\S+?)\\s*[—–-]+\\s*(.*)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern SUBPART_HEADING =
        Pattern.compile("^SUBPART\\s+(\\S+?)\\s*[—–-]+\\s*(.*)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern NUMBER_PREFIX = Pattern.compile("^(?:§+|(?i:PART\\b)|(?i:SUBPART\\b))\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    /**
     * Parse one bulk markup file
     */
    public ParsedTitle parse(SourceFile source) throws MarkupParseException {
        Document document;
        // Charset left to jsoup: a BOM or the XML prolog's encoding wins, UTF-8 otherwise
        try (InputStream in = Files.newInputStream(source.getPath())) {
            document = Jsoup.parse(in, null, "", Parser.xmlParser());
        } catch (IOException e) {
            throw new MarkupParseException("Failed to read " + source.getPath() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new MarkupParseException(source + ": " + e.getMessage(), e);
        }

        if (document.children().isEmpty()) {
            throw new MarkupParseException(source + (document.wholeText().isBlank()
                ? ": document is empty" : ": no markup elements found"));
        }
        return buildTree(document, source, source.getTitleNumber(), source.toString());
    }

    /**
     * Parse a version text. Plain text without markup yields a bare TITLE node carrying the text.
     */
    public ParsedTitle parseText(String text) throws MarkupParseException {
        if (text == null) {
            throw new MarkupParseException("Version text is missing");
        }
        return buildTree(toDocument(text, "version text"), null, "", "version text");
    }

    private Document toDocument(String markup, String origin) throws MarkupParseException {
        try {
            return Jsoup.parse(markup, "", Parser.xmlParser());
        } catch (RuntimeException e) {
            throw new MarkupParseException(origin + ": " + e.getMessage(), e);
        }
    }

    private ParsedTitle buildTree(Document document, SourceFile source, String titleNumber, String origin) {
        Element titleHeading = document.getElementsByTag("TITLEHD").first();
        String heading = titleHeading != null ? extractText(titleHeading, false) : "";

        MarkupNode title = new MarkupNode(NodeKind.TITLE, titleNumber, heading, extractText(document, false), false);
        TreeBuilder builder = new TreeBuilder(title, origin);
        builder.visit(document, null, null, null);

        log.debug("Parsed {}: {} parts, {} excluded subtrees, {} anomalies",
            origin, title.childrenOfKind(NodeKind.PART).size(), builder.excluded, builder.anomalies.size());

        return ParsedTitle.builder()
            .source(source)
            .root(title)
            .anomalies(List.copyOf(builder.anomalies))
            .excludedCount(builder.excluded)
            .build();
    }

    /**
     * Walks elements depth-first and attaches structural nodes to their owners
     */
    private final class TreeBuilder {
        private final MarkupNode title;
        private final String origin;
        private final List<String> anomalies = new ArrayList<>();
        private MarkupNode unassigned;
        private int excluded;

        private TreeBuilder(MarkupNode title, String origin) {
            this.title = title;
            this.origin = origin;
        }

        private void visit(Element element, MarkupNode part, MarkupNode subpart, MarkupNode section) {
            for (Element child : element.children()) {
                String tag = tagOf(child);

                if (EXCLUDED_TAGS.contains(tag)) {
                    excluded++;
                } else if ("PART".equals(tag)) {
                    MarkupNode node = structuralNode(child, NodeKind.PART);
                    if (part != null && !part.isSynthetic()) {
                        anomaly("PART " + node.getNumber() + " nested inside PART " + part.getNumber() + "; hoisted to title");
                    }
                    title.addChild(node);
                    visit(child, node, null, null);
                } else if ("SUBPART".equals(tag)) {
                    MarkupNode node = structuralNode(child, NodeKind.SUBPART);
                    MarkupNode owner = part != null ? part : unassigned(node);
                    owner.addChild(node);
                    visit(child, owner, node, null);
                } else if ("SECTION".equals(tag)) {
                    MarkupNode node = structuralNode(child, NodeKind.SECTION);
                    MarkupNode owner = part != null ? part : unassigned(node);
                    if (section != null) {
                        anomaly("SECTION " + node.getNumber() + " nested inside SECTION " + section.getNumber());
                    }
                    (subpart != null ? subpart : owner).addChild(node);
                    visit(child, owner, subpart, node);
                } else if (!LABEL_TAGS.contains(tag)) {
                    visit(child, part, subpart, section);
                }
            }
        }

        private MarkupNode unassigned(MarkupNode orphan) {
            anomaly(orphan.getKind() + " " + orphan.getNumber() + " found outside any PART; attached to unassigned part");
            if (unassigned == null) {
                unassigned = MarkupNode.unassignedPart();
                title.addChild(unassigned);
            }
            return unassigned;
        }

        private void anomaly(String message) {
            log.warn("Structural anomaly in {}: {}", origin, message);
            anomalies.add(message);
        }
    }

    private MarkupNode structuralNode(Element element, NodeKind kind) {
        String number = null;
        String heading = null;

        for (Element child : element.children()) {
            String tag = tagOf(child);
            String value = extractText(child, false);
            if ("PARTNO".equals(tag) || "SECTNO".equals(tag)) {
                if (number == null) {
                    number = cleanNumber(value);
                }
            } else if ("SUBJECT".equals(tag) || "RESERVED".equals(tag)) {
                if (heading == null && !value.isEmpty()) {
                    heading = value;
                }
            } else if ("HD".equals(tag)) {
                Pattern headingPattern = kind == NodeKind.PART ? PART_HEADING
                    : kind == NodeKind.SUBPART ? SUBPART_HEADING : null;
                Matcher matcher = headingPattern != null ? headingPattern.matcher(value) : null;
                if (matcher != null && matcher.matches()) {
                    if (number == null) {
                        number = cleanNumber(matcher.group(1));
                    }
                    if (heading == null) {
                        heading = matcher.group(2).strip();
                    }
                } else if (heading == null && !value.isEmpty()) {
                    heading = value;
                }
            }
        }

        String text = extractText(element, true);
        if (number == null) {
            // Inline numbering: <SECTION>1.1<CITATION>...</CITATION> text</SECTION>.
            // Only the element's own leading text may carry it, never a block child.
            String own = leadingText(element);
            Matcher leading = (kind == NodeKind.SUBPART ? LEADING_SUBPART : LEADING_NUMBER).matcher(own);
            if (leading.find() && text.startsWith(own)) {
                number = cleanNumber(leading.group(1));
                text = text.substring(leading.end()).strip();
            }
        }

        return new MarkupNode(kind, number != null ? number : "unknown", heading != null ? heading : "", text, false);
    }

    /**
     * Text nodes directly under the element, up to its first child element
     */
    private static String leadingText(Element element) {
        StringBuilder own = new StringBuilder();
        for (Node child : element.childNodes()) {
            if (child instanceof Element) {
                break;
            }
            if (child instanceof TextNode) {
                own.append(((TextNode) child).getWholeText());
            }
        }
        return WHITESPACE.matcher(own).replaceAll(" ").strip();
    }

    /**
     * Text of an element and its non-excluded descendants, in document order.
     * Block elements become separate paragraphs joined by a blank line.
     */
    private String extractText(Element owner, boolean skipLabels) {
        List<String> paragraphs = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        collectText(owner, skipLabels, paragraphs, current);
        flush(paragraphs, current);
        return String.join("\n\n", paragraphs);
    }

    private void collectText(Element element, boolean skipLabels, List<String> paragraphs, StringBuilder current) {
        for (Node child : element.childNodes()) {
            if (child instanceof TextNode) {
                current.append(((TextNode) child).getWholeText());
                continue;
            }
            if (!(child instanceof Element)) {
                continue;
            }

            Element nested = (Element) child;
            String tag = tagOf(nested);
            if (EXCLUDED_TAGS.contains(tag) || STRUCTURAL_TAGS.contains(tag)
                || (skipLabels && LABEL_TAGS.contains(tag))) {
                current.append(' ');
            } else if (BLOCK_TAGS.contains(tag)) {
                flush(paragraphs, current);
                collectText(nested, false, paragraphs, current);
                flush(paragraphs, current);
            } else {
                collectText(nested, false, paragraphs, current);
            }
        }
    }

    private static void flush(List<String> paragraphs, StringBuilder current) {
        String paragraph = WHITESPACE.matcher(current).replaceAll(" ").strip();
        if (!paragraph.isEmpty()) {
            paragraphs.add(paragraph);
        }
        current.setLength(0);
    }

    /**
     * Number as written in the source, minus surrounding whitespace and a leading § or keyword
     */
    static String cleanNumber(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = NUMBER_PREFIX.matcher(WHITESPACE.matcher(raw).replaceAll(" ").strip()).replaceFirst("").strip();
        return cleaned.isEmpty() ? null : cleaned;
    }

    private static String tagOf(Element element) {
        String name = element.tagName();
        int colon = name.indexOf(':');
        return (colon >= 0 ? name.substring(colon + 1) : name).toUpperCase(Locale.ROOT);
    }
}
