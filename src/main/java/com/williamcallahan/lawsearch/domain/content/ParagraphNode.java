package com.williamcallahan.lawsearch.domain.content;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code P} element: one Absatz of a norm, or a paragraph nested in a list or table cell.
 *
 * @param id source ID attribute, null when absent
 * @param children parsed child nodes in source order
 * @param rawText flattened, whitespace-collapsed text of the whole element
 * @param absatzNumber number token of a leading "(N)" marker, null when the text has none
 */
public record ParagraphNode(String id, List<ContentNode> children, String rawText, String absatzNumber)
        implements ContentNode {

    public ParagraphNode {
        children = List.copyOf(Objects.requireNonNull(children, "children"));
        rawText = Objects.requireNonNullElse(rawText, "");
    }

    /**
     * Returns the Absatz number extracted from the leading "(N)" marker.
     *
     * <p>The raw text keeps the marker; renderers strip it using this token.</p>
     *
     * @return Absatz number such as "2" or "3a" when the text starts with a marker
     */
    public Optional<String> sectionNumber() {
        return Optional.ofNullable(absatzNumber);
    }

    @Override
    public ContentNodeKind kind() {
        return ContentNodeKind.PARAGRAPH;
    }
}
