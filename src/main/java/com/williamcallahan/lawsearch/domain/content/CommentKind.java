package com.williamcallahan.lawsearch.domain.content;

import java.util.Arrays;
import java.util.Optional;

/**
 * Values of the {@code typ} attribute of a {@code kommentar} element.
 */
public enum CommentKind {
    STAND("Stand"),
    STAND_HINWEIS("Stand-Hinweis"),
    HINWEIS("Hinweis"),
    FUNDSTELLE("Fundstelle"),
    VERARBEITUNG("Verarbeitung");

    private final String markupValue;

    CommentKind(String markupValue) {
        this.markupValue = markupValue;
    }

    /**
     * Resolves the markup value exactly as written in the source.
     *
     * @param value attribute value, may be null
     * @return matching kind, empty for null or unknown values
     */
    public static Optional<CommentKind> fromMarkup(String value) {
        return Arrays.stream(values()).filter(kind -> kind.markupValue.equals(value)).findFirst();
    }
}
