package com.williamcallahan.lawsearch.service.markup;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Closed set of content tags the parser dispatches on. Anything else maps to {@link #UNKNOWN}
 * and is reduced to its flattened text.
 */
public enum MarkupTag {
    P("P"),
    DL("DL"),
    TABLE("table"),
    IMG("IMG"),
    FILE("FILE"),
    FN_AREA("FnArea"),
    TOC("TOC"),
    KOMMENTAR("kommentar"),
    PRE("pre"),
    REVISION("Revision"),
    BOLD("B"),
    ITALIC("I"),
    UNDERLINE("U"),
    SUPERSCRIPT("SUP"),
    SUBSCRIPT("SUB"),
    SPACED("SP"),
    SMALL("small"),
    CITATION("Citation"),
    BR("BR"),
    UNKNOWN("");

    private static final Map<String, MarkupTag> BY_NAME = Stream.of(values())
            .filter(tag -> tag != UNKNOWN)
            .collect(Collectors.toUnmodifiableMap(MarkupTag::tagName, Function.identity()));

    private final String tagName;

    MarkupTag(String tagName) {
        this.tagName = tagName;
    }

    /**
     * Gets the tag name exactly as it appears in the markup.
     */
    public String tagName() {
        return tagName;
    }

    /**
     * Resolves a tag name case-sensitively, as the schema defines it.
     *
     * @param tagName element name from the markup
     * @return matching tag, {@link #UNKNOWN} otherwise
     */
    public static MarkupTag fromTagName(String tagName) {
        if (tagName == null) {
            return UNKNOWN;
        }
        return BY_NAME.getOrDefault(tagName, UNKNOWN);
    }
}
