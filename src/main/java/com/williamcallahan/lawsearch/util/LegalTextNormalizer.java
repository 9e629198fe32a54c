package com.williamcallahan.lawsearch.util;

/**
 * Whitespace and case helpers shared by the markup parser and the query engine.
 *
 * Legal markup mixes hard line breaks, tabs and non-breaking spaces inside running text; these
 * helpers turn such fragments into single-line prose without changing anything else.
 */
public final class LegalTextNormalizer {

    private LegalTextNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Translates line breaks and tabs to spaces and collapses runs of spaces to one.
     *
     * <p>Leading and trailing spaces survive; callers trim whole blocks where needed.</p>
     *
     * @param text fragment to normalize (may be null)
     * @return normalized fragment, or empty string if null
     */
    public static String normalizeWhitespace(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            char translated = current == '\r' || current == '\n' || current == '\t' ? ' ' : current;
            if (translated == ' ' && endsWithSpace(normalized)) {
                continue;
            }
            normalized.append(translated);
        }
        return normalized.toString();
    }

    /**
     * Collapses every whitespace run (including non-breaking spaces) to a single space and trims.
     *
     * @param text text to collapse (may be null)
     * @return collapsed text, or empty string if null
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder collapsed = new StringBuilder(text.length());
        boolean pendingSpace = false;
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (isWhitespace(current)) {
                pendingSpace = collapsed.length() > 0;
                continue;
            }
            if (pendingSpace) {
                collapsed.append(' ');
                pendingSpace = false;
            }
            collapsed.append(current);
        }
        return collapsed.toString();
    }

    /**
     * Trims whitespace, including non-breaking spaces, from both ends.
     *
     * @param text text to trim (may be null)
     * @return trimmed text, or empty string if null
     */
    public static String trim(String text) {
        if (text == null) {
            return "";
        }
        int start = 0;
        int end = text.length();
        while (start < end && isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    /**
     * Lowercases character by character so that offsets in the folded text match the original.
     *
     * @param text text to fold (may be null)
     * @return folded text of identical length, or empty string if null
     */
    public static String foldCase(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder folded = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            folded.append(Character.toLowerCase(text.charAt(index)));
        }
        return folded.toString();
    }

    static boolean isWhitespace(char character) {
        return Character.isWhitespace(character) || Character.isSpaceChar(character);
    }

    private static boolean endsWithSpace(StringBuilder sb) {
        return sb.length() > 0 && sb.charAt(sb.length() - 1) == ' ';
    }
}
