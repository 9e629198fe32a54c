package com.williamcallahan.lawsearch.domain.content;

/**
 * Discriminant for the closed set of content tree node variants.
 */
public enum ContentNodeKind {
    TEXT,
    PARAGRAPH,
    DEFINITION_LIST,
    TABLE,
    IMAGE,
    FILE_REFERENCE,
    FOOTNOTE_AREA,
    TABLE_OF_CONTENTS,
    COMMENT,
    PREFORMATTED,
    FORMAT_SPAN,
    REVISION
}
