package com.dcruver.regmetrics.io;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the parsed hierarchy: TITLE, PART, SUBPART or SECTION.
 * Text holds the node's own extracted body text; nested structural nodes keep theirs.
 */
@Getter
public class MarkupNode {

    public static final String UNASSIGNED = "unassigned";

    private final NodeKind kind;
    private final String number;
    private final String heading;
    private final String text;
    private final boolean synthetic;
    private final List<MarkupNode> children = new ArrayList<>();

    public MarkupNode(NodeKind kind, String number, String heading, String text, boolean synthetic) {
        this.kind = kind;
        this.number = number;
        this.heading = heading;
        this.text = text;
        this.synthetic = synthetic;
    }

    /**
     * Placeholder part collecting nodes found outside any PART
     */
    static MarkupNode unassignedPart() {
        return new MarkupNode(NodeKind.PART, UNASSIGNED, "[Unassigned]", "", true);
    }

    void addChild(MarkupNode child) {
        children.add(child);
    }

    public List<MarkupNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<MarkupNode> childrenOfKind(NodeKind wanted) {
        return children.stream().filter(child -> child.kind == wanted).toList();
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    @Override
    public String toString() {
        return kind + " " + number;
    }
}
