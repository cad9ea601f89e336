package com.ifdefgraph.core.tree;

import java.util.List;

/**
 * Read-only view of one element of the structural converter's tagged tree.
 * Implemented once per tree/XML library so the rest of the core never touches that library.
 */
public interface TreeElement {

    /** Element tag. Preprocessor elements carry the {@code cpp:} prefix (e.g. {@code cpp:ifdef}). */
    String tag();

    /** Child elements in document order. Text-only content is not represented as a child. */
    List<TreeElement> children();

    /** Full text content of this element and all of its descendants, as it appears in the source. */
    String text();

    Span span();
}
