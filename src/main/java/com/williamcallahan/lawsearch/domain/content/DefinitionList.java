package com.williamcallahan.lawsearch.domain.content;

import java.util.List;
import java.util.Objects;

/**
 * A {@code DL} element holding numbered or lettered enumeration items.
 *
 * @param id source ID attribute, null when absent
 * @param indent Indent attribute, null when absent
 * @param font Font attribute, null when absent
 * @param type Type attribute (for example "arabic" or "alpha"), null when absent
 * @param items term/description pairs in source order
 */
public record DefinitionList(String id, String indent, String font, String type, List<DefinitionItem> items)
        implements ContentNode {

    public DefinitionList {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    @Override
    public ContentNodeKind kind() {
        return ContentNodeKind.DEFINITION_LIST;
    }
}
