package com.williamcallahan.lawsearch.domain.content;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code LA} element inside a description: either flat text or parsed children (nested lists).
 *
 * @param id source ID attribute, null when absent
 * @param size Size attribute restricted to normal, small or tiny; null otherwise
 * @param value Value attribute, null when absent
 * @param text flattened text when the element has no child elements, otherwise null
 * @param children parsed children when the element has child elements, otherwise empty
 */
public record ListParagraph(String id, String size, String value, String text, List<ContentNode> children) {

    public ListParagraph {
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    /**
     * Returns the flat text form, present only for leaf list paragraphs.
     */
    public Optional<String> flatText() {
        return Optional.ofNullable(text);
    }
}
