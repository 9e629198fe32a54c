package com.williamcallahan.lawsearch.domain.content;

import java.util.Objects;

/**
 * A term immediately followed by its description. Items only exist for complete pairs.
 *
 * @param term the {@code DT} label, for example "1." or "a)"
 * @param description the {@code DD} body
 */
public record DefinitionItem(DefinitionTerm term, DefinitionDescription description) {

    public DefinitionItem {
        Objects.requireNonNull(term, "term");
        Objects.requireNonNull(description, "description");
    }
}
