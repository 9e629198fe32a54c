package com.williamcallahan.lawsearch.service;

import com.williamcallahan.lawsearch.domain.content.ContentNode;
import com.williamcallahan.lawsearch.domain.content.DefinitionItem;
import com.williamcallahan.lawsearch.domain.content.DefinitionList;
import com.williamcallahan.lawsearch.domain.content.ListParagraph;
import com.williamcallahan.lawsearch.domain.content.ParagraphNode;
import com.williamcallahan.lawsearch.domain.content.TextRun;
import com.williamcallahan.lawsearch.domain.norm.LawDocument;
import com.williamcallahan.lawsearch.domain.norm.Norm;
import com.williamcallahan.lawsearch.domain.norm.NormMetadata;
import com.williamcallahan.lawsearch.domain.norm.TextBody;
import com.williamcallahan.lawsearch.domain.reference.ParsedReference;
import com.williamcallahan.lawsearch.util.LegalTextNormalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Renders norms as plain-text blocks with an equals-sign banner.
 *
 * <p>A banner block is the rule line, the law code with the paragraph label, an optional title
 * line, another rule line, a blank line and the body text.</p>
 */
public class NormFormatter {

    public static final int DEFAULT_RULE_WIDTH = 70;

    private static final String UNKNOWN_DESIGNATION = "?";
    private static final String UNKNOWN_TITLE = "Unknown";
    private static final int INFO_PREVIEW_PARAGRAPHS = 5;
    private static final int INFO_TITLE_LENGTH = 50;
    private static final int NOTE_LINE_INDEX = 3;
    private static final String INDENT_UNIT = "  ";

    private final String rule;

    public NormFormatter() {
        this(DEFAULT_RULE_WIDTH);
    }

    /**
     * Creates a formatter with the given banner rule width.
     *
     * @param ruleWidth number of '=' characters per rule line, at least 1
     */
    public NormFormatter(int ruleWidth) {
        if (ruleWidth < 1) {
            throw new IllegalArgumentException("Rule width must be positive");
        }
        this.rule = "=".repeat(ruleWidth);
    }

    /**
     * Formats a whole paragraph with its banner.
     *
     * @param lawCode law code shown in the header
     * @param norm paragraph norm
     * @return banner block, empty when the norm has no metadata
     */
    public String formatParagraph(String lawCode, Norm norm) {
        Optional<NormMetadata> metadata = norm.findMetadata();
        if (metadata.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        lines.add(rule);
        lines.add(lawCode + " " + designationOf(metadata.get()));
        if (metadata.get().title() != null) {
            lines.add(metadata.get().title());
        }
        lines.add(rule);
        String text = NormTextExtractor.normText(norm);
        if (!text.isEmpty()) {
            lines.add("");
            lines.add(text);
        }
        return String.join("\n", lines);
    }

    /**
     * Formats one Absatz of a paragraph with a banner naming the requested section number.
     */
    public String formatSection(String lawCode, Norm norm, String sectionNumber, ParagraphNode paragraph) {
        String designation = norm.findMetadata().map(NormFormatter::designationOf).orElse(UNKNOWN_DESIGNATION);
        return String.join(
                "\n",
                rule,
                lawCode + " " + designation + " Absatz " + sectionNumber,
                rule,
                "",
                NormTextExtractor.paragraphText(paragraph));
    }

    /**
     * Inserts a "(Gesucht: ...)" line below the banner naming the finer coordinates requested.
     *
     * @param formatted banner block of the resolved section
     * @param reference parsed citation
     * @return block with the note line, unchanged when the citation has no finer coordinates
     */
    public String withReferenceNote(String formatted, ParsedReference reference) {
        List<String> noteParts = new ArrayList<>();
        reference.nummer().ifPresent(number -> noteParts.add("Nummer " + number));
        reference.buchstabe().ifPresent(letter -> noteParts.add("Buchstabe " + letter));
        reference.satz().ifPresent(sentence -> noteParts.add("Satz " + sentence));
        if (noteParts.isEmpty()) {
            return formatted;
        }
        List<String> lines = new ArrayList<>(Arrays.asList(formatted.split("\n", -1)));
        lines.add(Math.min(NOTE_LINE_INDEX, lines.size()), "(Gesucht: " + String.join(" ", noteParts) + ")");
        return String.join("\n", lines);
    }

    /**
     * Summarizes a law: title, abbreviations, counts and the first few paragraphs.
     */
    public String lawInfo(String lawCode, LawDocument document) {
        List<Norm> paragraphs = document.paragraphs();
        List<String> lines = new ArrayList<>();
        lines.add(rule);
        lines.add(lawCode + ": " + document.title().orElse(UNKNOWN_TITLE));
        lines.add(rule);
        lines.add("Abbreviations: " + String.join(", ", document.abbreviations()));
        lines.add("Total norms:   " + document.norms().size());
        lines.add("Paragraphs:    " + paragraphs.size());
        lines.add("Structure:     " + document.structure().size() + " elements");
        lines.add("");
        lines.add("First 5 paragraphs:");
        for (Norm paragraph : paragraphs.subList(0, Math.min(INFO_PREVIEW_PARAGRAPHS, paragraphs.size()))) {
            String title = paragraph.title().orElse("");
            if (title.length() > INFO_TITLE_LENGTH) {
                title = title.substring(0, INFO_TITLE_LENGTH);
            }
            lines.add(String.format("  %-15s %s", paragraph.designation().orElse(""), title));
        }
        return String.join("\n", lines);
    }

    /**
     * Renders a norm's body one Absatz per block, with definition lists expanded line by line.
     *
     * <p>Each Absatz starts with its "(N)" marker followed by its intro text; list items follow
     * as "term text" lines indented two spaces per nesting level. Blocks are separated by a blank
     * line. A body without paragraph nodes falls back to its cached text.</p>
     *
     * @param norm norm to render
     * @return rendered text, empty when the norm has no body
     */
    public String formatNormContent(Norm norm) {
        Optional<TextBody> body = norm.textBody();
        if (body.isEmpty() || body.get().elements().isEmpty()) {
            return "";
        }
        List<ParagraphNode> paragraphs = new ArrayList<>();
        for (ContentNode node : body.get().elements()) {
            if (node instanceof ParagraphNode paragraph) {
                paragraphs.add(paragraph);
            }
        }
        if (paragraphs.isEmpty()) {
            return body.get().cachedText().orElse("");
        }
        List<String> lines = new ArrayList<>();
        for (int index = 0; index < paragraphs.size(); index++) {
            if (index > 0) {
                lines.add("");
            }
            lines.addAll(absatzLines(paragraphs.get(index)));
        }
        return String.join("\n", lines);
    }

    List<String> definitionListLines(DefinitionList list, int indentLevel) {
        String indent = INDENT_UNIT.repeat(indentLevel);
        List<String> lines = new ArrayList<>();
        for (DefinitionItem item : list.items()) {
            String term = item.term().text();
            Optional<ListParagraph> body = item.description().body();
            if (body.isEmpty()) {
                continue;
            }
            List<DefinitionList> nestedLists = new ArrayList<>();
            List<String> textParts = new ArrayList<>();
            for (ContentNode child : body.get().children()) {
                if (child instanceof DefinitionList nested) {
                    nestedLists.add(nested);
                } else if (child instanceof TextRun textRun) {
                    textParts.add(textRun.text());
                }
            }
            String flatText = body.get().flatText().orElse("");
            if (nestedLists.isEmpty()) {
                String joined = LegalTextNormalizer.collapseWhitespace(String.join(" ", textParts));
                String text = firstNonEmpty(flatText, joined, NormTextExtractor.elementsText(body.get().children()));
                if (!text.isEmpty()) {
                    lines.add(indent + term + " " + text);
                }
            } else {
                String intro = firstNonEmpty(
                        flatText, LegalTextNormalizer.collapseWhitespace(String.join(" ", textParts)));
                lines.add(intro.isEmpty() ? indent + term : indent + term + " " + intro);
                for (DefinitionList nested : nestedLists) {
                    lines.addAll(definitionListLines(nested, indentLevel + 1));
                }
            }
        }
        return lines;
    }

    private List<String> absatzLines(ParagraphNode paragraph) {
        String absatz = paragraph.sectionNumber().orElse(null);
        List<DefinitionList> lists = new ArrayList<>();
        for (ContentNode child : paragraph.children()) {
            if (child instanceof DefinitionList list) {
                lists.add(list);
            }
        }
        List<String> lines = new ArrayList<>();
        if (lists.isEmpty()) {
            String text = paragraph.rawText();
            if (absatz != null) {
                String clean = stripAbsatzMarker(text, absatz);
                lines.add(clean.isEmpty() ? "(" + absatz + ")" : "(" + absatz + ") " + clean);
            } else if (!text.isEmpty()) {
                lines.add(text);
            }
            return lines;
        }
        String intro = introText(paragraph);
        if (absatz != null) {
            intro = stripAbsatzMarker(intro, absatz);
        }
        if (absatz != null && !intro.isEmpty()) {
            lines.add("(" + absatz + ") " + intro);
        } else if (absatz != null) {
            lines.add("(" + absatz + ")");
        } else if (!intro.isEmpty()) {
            lines.add(intro);
        }
        for (DefinitionList list : lists) {
            lines.addAll(definitionListLines(list, 0));
        }
        return lines;
    }

    private static String introText(ParagraphNode paragraph) {
        List<String> parts = new ArrayList<>();
        for (ContentNode child : paragraph.children()) {
            if (child instanceof DefinitionList) {
                break;
            }
            if (child instanceof TextRun textRun) {
                parts.add(textRun.text());
            }
        }
        return LegalTextNormalizer.collapseWhitespace(String.join(" ", parts));
    }

    private static String stripAbsatzMarker(String text, String absatz) {
        String marker = "(" + absatz + ")";
        return text.startsWith(marker) ? LegalTextNormalizer.trim(text.substring(marker.length())) : text;
    }

    private static String firstNonEmpty(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isEmpty()) {
                return candidate;
            }
        }
        return "";
    }

    private static String designationOf(NormMetadata metadata) {
        return metadata.designation() == null ? UNKNOWN_DESIGNATION : metadata.designation();
    }
}
