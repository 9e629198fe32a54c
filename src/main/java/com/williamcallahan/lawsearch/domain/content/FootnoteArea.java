package com.williamcallahan.lawsearch.domain.content;

import java.util.List;
import java.util.Objects;

/**
 * An {@code FnArea} element collecting footnote reference ids.
 *
 * @param line Line attribute, "0" or "1"
 * @param size Size attribute, one of normal, large, small
 * @param referenceIds ID attributes of the {@code FnR} children in source order
 */
public record FootnoteArea(String line, String size, List<String> referenceIds) implements ContentNode {

    public FootnoteArea {
        Objects.requireNonNull(line, "line");
        Objects.requireNonNull(size, "size");
        referenceIds = List.copyOf(Objects.requireNonNull(referenceIds, "referenceIds"));
    }

    @Override
    public ContentNodeKind kind() {
        return ContentNodeKind.FOOTNOTE_AREA;
    }
}
