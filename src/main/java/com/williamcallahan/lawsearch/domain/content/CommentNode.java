package com.williamcallahan.lawsearch.domain.content;

import java.util.Objects;

/**
 * An inline {@code kommentar} element.
 *
 * @param commentKind kind from the typ attribute, {@link CommentKind#HINWEIS} when absent or unknown
 * @param text leading text of the element as written, null when it had none
 */
public record CommentNode(CommentKind commentKind, String text) implements ContentNode {

    public CommentNode {
        Objects.requireNonNull(commentKind, "commentKind");
    }

    @Override
    public ContentNodeKind kind() {
        return ContentNodeKind.COMMENT;
    }
}
