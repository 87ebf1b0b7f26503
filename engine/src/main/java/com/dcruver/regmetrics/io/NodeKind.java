package com.dcruver.regmetrics.io;

/**
 * Structural variants of the parsed regulatory tree.
 * Citation, note and editorial subtrees never become nodes; they are only counted.
 */
public enum NodeKind {
    TITLE,
    PART,
    SUBPART,
    SECTION
}
