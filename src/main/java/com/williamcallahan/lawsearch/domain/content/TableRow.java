package com.williamcallahan.lawsearch.domain.content;

import java.util.List;
import java.util.Objects;

/**
 * A table {@code row} with its cells in column order.
 *
 * @param id source ID attribute, null when absent
 * @param rowsep rowsep attribute, null when absent
 * @param valign valign attribute, null when absent
 * @param entries {@code entry} cells
 */
public record TableRow(String id, String rowsep, String valign, List<TableEntry> entries) {

    public TableRow {
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    }
}
