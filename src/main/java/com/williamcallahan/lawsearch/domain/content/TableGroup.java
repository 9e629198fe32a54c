package com.williamcallahan.lawsearch.domain.content;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code tgroup}: column specs plus header, body and footer row groups.
 *
 * @param columns declared column count
 * @param columnSpecs {@code colspec} children in source order
 * @param header {@code thead} rows, null when the group has no header
 * @param body {@code tbody} rows, empty when the source had no body
 * @param footer {@code tfoot} rows, null when the group has no footer
 */
public record TableGroup(
        int columns, List<ColumnSpec> columnSpecs, List<TableRow> header, List<TableRow> body, List<TableRow> footer) {

    public TableGroup {
        columnSpecs = List.copyOf(Objects.requireNonNull(columnSpecs, "columnSpecs"));
        header = header == null ? null : List.copyOf(header);
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        footer = footer == null ? null : List.copyOf(footer);
    }

    public Optional<List<TableRow>> headerRows() {
        return Optional.ofNullable(header);
    }

    public Optional<List<TableRow>> footerRows() {
        return Optional.ofNullable(footer);
    }
}
