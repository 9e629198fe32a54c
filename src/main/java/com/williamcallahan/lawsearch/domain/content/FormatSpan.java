package com.williamcallahan.lawsearch.domain.content;

import java.util.List;
import java.util.Objects;

/**
 * Inline formatting such as bold, italic, superscript or a citation span.
 *
 * @param tag source tag name, for example "B" or "Citation"
 * @param id ID attribute (any capitalization), null when absent
 * @param styleClass Class attribute (any capitalization), null when absent
 * @param text leading text of the element as written, null when it had none
 * @param children parsed children, including the normalized leading text
 */
public record FormatSpan(String tag, String id, String styleClass, String text, List<ContentNode> children)
        implements ContentNode {

    public FormatSpan {
        Objects.requireNonNull(tag, "tag");
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    @Override
    public ContentNodeKind kind() {
        return ContentNodeKind.FORMAT_SPAN;
    }
}
