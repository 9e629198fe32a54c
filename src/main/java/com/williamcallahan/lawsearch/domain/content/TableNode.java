package com.williamcallahan.lawsearch.domain.content;

import java.util.List;
import java.util.Objects;

/**
 * A {@code table} element with one or more column groups.
 *
 * @param id source ID attribute (any capitalization), null when absent
 * @param frame frame attribute, null when absent
 * @param colsep colsep attribute, null when absent
 * @param rowsep rowsep attribute, null when absent
 * @param title text of the {@code Title} child, null when absent
 * @param groups {@code tgroup} children in source order
 */
public record TableNode(String id, String frame, String colsep, String rowsep, String title, List<TableGroup> groups)
        implements ContentNode {

    public TableNode {
        groups = List.copyOf(Objects.requireNonNull(groups, "groups"));
    }

    @Override
    public ContentNodeKind kind() {
        return ContentNodeKind.TABLE;
    }
}
