package com.williamcallahan.lawsearch.domain.content;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code DD} body of a definition list item.
 *
 * @param id source ID attribute, null when absent
 * @param listParagraph first {@code LA} child, null when the description has none
 * @param revisions {@code Revision} children in source order
 */
public record DefinitionDescription(String id, ListParagraph listParagraph, List<RevisionBlock> revisions) {

    public DefinitionDescription {
        revisions = List.copyOf(Objects.requireNonNull(revisions, "revisions"));
    }

    /**
     * Returns the list paragraph carrying the description text, when present.
     */
    public Optional<ListParagraph> body() {
        return Optional.ofNullable(listParagraph);
    }
}
