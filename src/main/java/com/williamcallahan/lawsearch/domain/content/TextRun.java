package com.williamcallahan.lawsearch.domain.content;

import java.util.Objects;

/**
 * Plain text between or inside elements, already whitespace-normalized by the parser.
 *
 * @param text text content; a single newline represents a hard line break
 */
public record TextRun(String text) implements ContentNode {

    static final TextRun LINE_BREAK = new TextRun("\n");

    public TextRun {
        Objects.requireNonNull(text, "text");
    }

    /**
     * Returns the shared line-break node emitted for {@code BR} elements.
     */
    public static TextRun lineBreak() {
        return LINE_BREAK;
    }

    @Override
    public ContentNodeKind kind() {
        return ContentNodeKind.TEXT;
    }
}
