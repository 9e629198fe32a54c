package com.williamcallahan.lawsearch.domain.content;

import java.util.List;
import java.util.Objects;

/**
 * A {@code TOC} element.
 *
 * @param id source ID attribute, null when absent
 * @param children parsed children in source order
 */
public record TableOfContents(String id, List<ContentNode> children) implements ContentNode {

    public TableOfContents {
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    @Override
    public ContentNodeKind kind() {
        return ContentNodeKind.TABLE_OF_CONTENTS;
    }
}
