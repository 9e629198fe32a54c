package com.williamcallahan.lawsearch.service;

import com.williamcallahan.lawsearch.domain.content.CommentNode;
import com.williamcallahan.lawsearch.domain.content.ContentNode;
import com.williamcallahan.lawsearch.domain.content.FormatSpan;
import com.williamcallahan.lawsearch.domain.content.ParagraphNode;
import com.williamcallahan.lawsearch.domain.content.PreformattedText;
import com.williamcallahan.lawsearch.domain.content.RevisionBlock;
import com.williamcallahan.lawsearch.domain.content.TableOfContents;
import com.williamcallahan.lawsearch.domain.content.TextRun;
import com.williamcallahan.lawsearch.domain.norm.Norm;
import com.williamcallahan.lawsearch.domain.norm.TextBody;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Plain-text views of parsed norms, used by search and by the banner formatter.
 *
 * <p>Cached flattened text is preferred everywhere; reconstruction from the node tree only happens
 * when the parser did not record it.</p>
 */
public final class NormTextExtractor {

    private NormTextExtractor() {}

    /**
     * Returns the full text of a norm's main body, or an empty string when it has none.
     */
    public static String normText(Norm norm) {
        Optional<TextBody> body = norm.textBody();
        if (body.isEmpty()) {
            return "";
        }
        Optional<String> cached = body.get().cachedText();
        if (cached.isPresent()) {
            return cached.get();
        }
        List<String> parts = new ArrayList<>();
        for (ContentNode node : body.get().elements()) {
            if (node instanceof TextRun textRun) {
                parts.add(textRun.text());
            } else if (node instanceof ParagraphNode paragraph) {
                parts.add(paragraphText(paragraph));
            }
        }
        return String.join("\n", parts);
    }

    /**
     * Returns the text of one paragraph node: its flattened text, else its direct child texts.
     */
    public static String paragraphText(ParagraphNode paragraph) {
        if (!paragraph.rawText().isEmpty()) {
            return paragraph.rawText();
        }
        List<String> parts = new ArrayList<>();
        for (ContentNode child : paragraph.children()) {
            ownText(child).ifPresent(parts::add);
        }
        return String.join(" ", parts).strip();
    }

    /**
     * Recursively extracts text from a node list, joining the pieces with single spaces.
     *
     * <p>Definition lists are skipped; callers that need them render them separately. Tables,
     * images, file references and footnote areas contribute nothing.</p>
     *
     * @param nodes nodes in document order
     * @return extracted text, trimmed
     */
    public static String elementsText(List<ContentNode> nodes) {
        List<String> parts = new ArrayList<>();
        for (ContentNode node : nodes) {
            String text = nodeText(node);
            if (text != null) {
                parts.add(text);
            }
        }
        return String.join(" ", parts).strip();
    }

    private static String nodeText(ContentNode node) {
        switch (node.kind()) {
            case TEXT:
                return ((TextRun) node).text();
            case PARAGRAPH:
                ParagraphNode paragraph = (ParagraphNode) node;
                if (!paragraph.rawText().isEmpty()) {
                    return paragraph.rawText();
                }
                return paragraph.children().isEmpty() ? null : elementsText(paragraph.children());
            case FORMAT_SPAN:
                FormatSpan span = (FormatSpan) node;
                return ownText(span).orElseGet(() -> nestedText(span.children()));
            case COMMENT:
            case PREFORMATTED:
                return ownText(node).orElse(null);
            case TABLE_OF_CONTENTS:
                return nestedText(((TableOfContents) node).children());
            case REVISION:
                return nestedText(((RevisionBlock) node).children());
            case DEFINITION_LIST:
            case TABLE:
            case IMAGE:
            case FILE_REFERENCE:
            case FOOTNOTE_AREA:
                return null;
            default:
                throw new IllegalStateException("Unhandled content node kind: " + node.kind());
        }
    }

    private static String nestedText(List<ContentNode> children) {
        return children.isEmpty() ? null : elementsText(children);
    }

    private static Optional<String> ownText(ContentNode node) {
        String text = null;
        if (node instanceof TextRun textRun) {
            text = textRun.text();
        } else if (node instanceof FormatSpan span) {
            text = span.text();
        } else if (node instanceof CommentNode comment) {
            text = comment.text();
        } else if (node instanceof PreformattedText preformatted) {
            text = preformatted.text();
        }
        return Optional.ofNullable(text).filter(value -> !value.isEmpty());
    }
}
