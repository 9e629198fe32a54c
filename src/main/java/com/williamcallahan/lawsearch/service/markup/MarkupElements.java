package com.williamcallahan.lawsearch.service.markup;

import com.williamcallahan.lawsearch.util.LegalTextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jsoup.nodes.Attributes;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Element-tree accessors on top of jsoup nodes.
 *
 * <p>The legal markup is read as an element tree with interleaved text: an element's leading text
 * is everything before its first child element, and a child's tail is everything between it and
 * the next sibling element. Comments and processing instructions contribute nothing.</p>
 */
public final class MarkupElements {

    private static final String FOOTNOTE_MARKER_CLASS = "Rec";

    private MarkupElements() {}

    /**
     * Returns the text that precedes the first child element.
     */
    public static String leadingText(Element element) {
        StringBuilder text = new StringBuilder();
        for (Node node : element.childNodes()) {
            if (node instanceof Element) {
                break;
            }
            appendText(node, text);
        }
        return text.toString();
    }

    /**
     * Returns the text between this element and its next sibling element.
     */
    public static String tailText(Element element) {
        StringBuilder text = new StringBuilder();
        Node sibling = element.nextSibling();
        while (sibling != null && !(sibling instanceof Element)) {
            appendText(sibling, text);
            sibling = sibling.nextSibling();
        }
        return text.toString();
    }

    /**
     * Returns the first direct child with the given tag name.
     */
    public static Optional<Element> firstChild(Element parent, String tagName) {
        for (Element child : parent.children()) {
            if (child.tagName().equals(tagName)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns all direct children with the given tag name, in source order.
     */
    public static List<Element> children(Element parent, String tagName) {
        List<Element> matches = new ArrayList<>();
        for (Element child : parent.children()) {
            if (child.tagName().equals(tagName)) {
                matches.add(child);
            }
        }
        return matches;
    }

    /**
     * Returns the trimmed leading text of the first child with the given tag.
     *
     * @return text, or null when the child is missing or has no text
     */
    public static String childText(Element parent, String tagName) {
        return firstChild(parent, tagName)
                .map(child -> LegalTextNormalizer.trim(leadingText(child)))
                .filter(text -> !text.isEmpty())
                .orElse(null);
    }

    /**
     * Returns the trimmed, non-empty leading texts of every child with the given tag.
     */
    public static List<String> allChildTexts(Element parent, String tagName) {
        List<String> texts = new ArrayList<>();
        for (Element child : children(parent, tagName)) {
            String text = LegalTextNormalizer.trim(leadingText(child));
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }
        return texts;
    }

    /**
     * Looks up an attribute under several capitalizations, first non-empty value wins. Names are
     * matched exactly.
     *
     * @param element element to read
     * @param names attribute names in priority order, for example "ID", "Id", "id"
     * @return attribute value, or null when none is present
     */
    public static String attribute(Element element, String... names) {
        Attributes attributes = element.attributes();
        for (String name : names) {
            if (attributes.hasKey(name)) {
                String value = attributes.get(name);
                if (!value.isEmpty()) {
                    return value;
                }
            }
        }
        return null;
    }

    /**
     * Returns true for superscripts of class "Rec", the inline footnote markers.
     */
    public static boolean isFootnoteMarker(Element element) {
        return MarkupTag.fromTagName(element.tagName()) == MarkupTag.SUPERSCRIPT
                && FOOTNOTE_MARKER_CLASS.equals(attribute(element, "class", "Class"));
    }

    /**
     * Flattens an element to plain text.
     *
     * <p>Leading text, each child's flattened text and each tail are joined with spaces, then all
     * whitespace runs collapse to one space. Footnote markers contribute only their tail.</p>
     *
     * @param element element to flatten
     * @return collapsed text, empty when the element holds no text
     */
    public static String flattenText(Element element) {
        List<String> parts = new ArrayList<>();
        parts.add(leadingText(element));
        for (Element child : element.children()) {
            if (!isFootnoteMarker(child)) {
                parts.add(flattenText(child));
            }
            parts.add(tailText(child));
        }
        return LegalTextNormalizer.collapseWhitespace(String.join(" ", parts));
    }

    private static void appendText(Node node, StringBuilder text) {
        if (node instanceof TextNode textNode) {
            text.append(textNode.getWholeText());
        }
    }
}
