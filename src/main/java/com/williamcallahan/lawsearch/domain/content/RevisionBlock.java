package com.williamcallahan.lawsearch.domain.content;

import java.util.List;
import java.util.Objects;

/**
 * A {@code Revision} block marking amended text.
 *
 * @param id source ID attribute, null when absent
 * @param postfix Postfix attribute, null when absent
 * @param children parsed children in source order
 */
public record RevisionBlock(String id, String postfix, List<ContentNode> children) implements ContentNode {

    public RevisionBlock {
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    @Override
    public ContentNodeKind kind() {
        return ContentNodeKind.REVISION;
    }
}
