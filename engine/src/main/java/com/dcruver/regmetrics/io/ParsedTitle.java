package com.dcruver.regmetrics.io;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of parsing one markup document: the TITLE-rooted tree plus what was
 * dropped or repaired on the way.
 */
@Data
@Builder
public class ParsedTitle {
    private final SourceFile source;  // null for version texts
    private final MarkupNode root;
    private final List<String> anomalies;
    private final int excludedCount;

    public List<MarkupNode> parts() {
        return root.childrenOfKind(NodeKind.PART);
    }

    /**
     * All SECTION nodes in document order
     */
    public List<MarkupNode> sections() {
        List<MarkupNode> sections = new ArrayList<>();
        collect(root, NodeKind.SECTION, sections);
        return sections;
    }

    public int sectionCount() {
        return sections().size();
    }

    public int subpartCount() {
        List<MarkupNode> subparts = new ArrayList<>();
        collect(root, NodeKind.SUBPART, subparts);
        return subparts.size();
    }

    /**
     * Extracted text of the whole tree, depth-first, one block per node
     */
    public String bodyText() {
        List<String> blocks = new ArrayList<>();
        appendText(root, blocks);
        return String.join("\n\n", blocks);
    }

    private static void collect(MarkupNode node, NodeKind kind, List<MarkupNode> out) {
        for (MarkupNode child : node.getChildren()) {
            if (child.getKind() == kind) {
                out.add(child);
            }
            collect(child, kind, out);
        }
    }

    private static void appendText(MarkupNode node, List<String> blocks) {
        if (node.hasText()) {
            blocks.add(node.getText());
        }
        for (MarkupNode child : node.getChildren()) {
            appendText(child, blocks);
        }
    }
}
