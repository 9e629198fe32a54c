package com.williamcallahan.lawsearch.domain.content;

import java.util.Objects;

/**
 * A {@code pre} block, stored as its flattened text.
 */
public record PreformattedText(String text) implements ContentNode {

    public PreformattedText {
        text = Objects.requireNonNullElse(text, "");
    }

    @Override
    public ContentNodeKind kind() {
        return ContentNodeKind.PREFORMATTED;
    }
}
