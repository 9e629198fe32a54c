package com.williamcallahan.lawsearch.domain.content;

import java.util.List;
import java.util.Objects;

/**
 * A table cell. Its content goes through the same recursion as any other element, so lists and
 * format spans inside cells survive.
 *
 * @param id source ID attribute, null when absent
 * @param align align attribute
 * @param valign valign attribute
 * @param columnName colname attribute
 * @param spanStart namest attribute
 * @param spanEnd nameend attribute
 * @param moreRows morerows attribute, null when absent or not numeric
 * @param colsep colsep attribute
 * @param rowsep rowsep attribute
 * @param content parsed cell content
 */
public record TableEntry(
        String id,
        String align,
        String valign,
        String columnName,
        String spanStart,
        String spanEnd,
        Integer moreRows,
        String colsep,
        String rowsep,
        List<ContentNode> content) {

    public TableEntry {
        content = List.copyOf(Objects.requireNonNull(content, "content"));
    }
}
