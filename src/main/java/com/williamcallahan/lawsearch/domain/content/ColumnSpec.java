package com.williamcallahan.lawsearch.domain.content;

/**
 * A {@code colspec} entry. All components are null when the attribute is absent or unparseable.
 *
 * @param name colname
 * @param position colnum
 * @param width colwidth
 * @param align align
 * @param colsep colsep
 * @param rowsep rowsep
 */
public record ColumnSpec(String name, Integer position, String width, String align, String colsep, String rowsep) {}
