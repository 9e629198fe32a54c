package com.williamcallahan.lawsearch.domain.content;

import java.util.Objects;

/**
 * {@code DT} label of a definition list item.
 *
 * @param id source ID attribute, null when absent
 * @param text flattened label text, empty when the element had no text
 */
public record DefinitionTerm(String id, String text) {

    public DefinitionTerm {
        text = Objects.requireNonNullElse(text, "");
    }
}
