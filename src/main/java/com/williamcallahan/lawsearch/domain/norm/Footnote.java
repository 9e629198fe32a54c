package com.williamcallahan.lawsearch.domain.norm;

import com.williamcallahan.lawsearch.domain.content.ContentNode;
import java.util.List;
import java.util.Objects;

/**
 * A single {@code Footnote} of a text block.
 *
 * @param id ID attribute, empty when absent
 * @param prefix Prefix attribute
 * @param marker FnZ attribute, the printed footnote marker
 * @param postfix Postfix attribute
 * @param position Pos attribute
 * @param group Group attribute
 * @param content parsed footnote content
 */
public record Footnote(
        String id,
        String prefix,
        String marker,
        String postfix,
        String position,
        String group,
        List<ContentNode> content) {

    public Footnote {
        id = Objects.requireNonNullElse(id, "");
        content = List.copyOf(Objects.requireNonNull(content, "content"));
    }
}
