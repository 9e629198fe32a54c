package com.williamcallahan.lawsearch.domain.norm;

import com.williamcallahan.lawsearch.domain.content.ContentNode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of a parsed norm text (the {@code Content} element).
 *
 * @param id ID attribute, null when absent
 * @param elements top-level content nodes in source order
 * @param rawText flattened text of the whole body, null when not cached
 */
public record TextBody(String id, List<ContentNode> elements, String rawText) {

    public TextBody {
        elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
    }

    /**
     * Returns the cached flattened text when it is present and non-empty.
     */
    public Optional<String> cachedText() {
        return Optional.ofNullable(rawText).filter(text -> !text.isEmpty());
    }
}
