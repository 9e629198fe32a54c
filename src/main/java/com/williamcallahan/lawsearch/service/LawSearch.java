package com.williamcallahan.lawsearch.service;

import com.williamcallahan.lawsearch.domain.content.ContentNode;
import com.williamcallahan.lawsearch.domain.content.ParagraphNode;
import com.williamcallahan.lawsearch.domain.norm.LawDocument;
import com.williamcallahan.lawsearch.domain.norm.Norm;
import com.williamcallahan.lawsearch.domain.norm.TextBody;
import com.williamcallahan.lawsearch.domain.reference.ParsedReference;
import com.williamcallahan.lawsearch.domain.search.ParagraphSummary;
import com.williamcallahan.lawsearch.domain.search.SearchHit;
import com.williamcallahan.lawsearch.util.LawReferenceParser;
import com.williamcallahan.lawsearch.util.LegalTextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Citation lookup and full-text search over one parsed law.
 *
 * <p>Instances are bound to a single document and law code. Every miss is reported as an empty
 * result, never as an exception.</p>
 */
public class LawSearch {
    private static final Logger log = LoggerFactory.getLogger(LawSearch.class);

    public static final int DEFAULT_CONTEXT_CHARS = 100;

    private static final String ELLIPSIS = "...";

    private final LawDocument document;
    private final String lawCode;
    private final int contextChars;
    private final NormFormatter formatter;

    /**
     * Creates a search with the default context window and banner width.
     *
     * @param document parsed law
     * @param lawCode code shown in banners, for example "HGB"
     */
    public LawSearch(LawDocument document, String lawCode) {
        this(document, lawCode, DEFAULT_CONTEXT_CHARS, new NormFormatter());
    }

    /**
     * Creates a search with explicit output settings.
     *
     * @param document parsed law
     * @param lawCode code shown in banners
     * @param contextChars characters of context kept on each side of a search match
     * @param formatter banner formatter
     */
    public LawSearch(LawDocument document, String lawCode, int contextChars, NormFormatter formatter) {
        this.document = Objects.requireNonNull(document, "document");
        this.lawCode = Objects.requireNonNull(lawCode, "lawCode");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        if (contextChars < 0) {
            throw new IllegalArgumentException("Context window must not be negative");
        }
        this.contextChars = contextChars;
    }

    public LawDocument document() {
        return document;
    }

    public String lawCode() {
        return lawCode;
    }

    /**
     * Formats a paragraph by label.
     *
     * @param label paragraph label, with or without section sign ("§ 8b", "8b")
     * @return banner block of the first paragraph whose label matches exactly
     */
    public Optional<String> findParagraph(String label) {
        return document.findParagraph(label).map(norm -> formatter.formatParagraph(lawCode, norm));
    }

    /**
     * Formats the n-th paragraph node of a paragraph's body.
     *
     * <p>Sections are counted by position among the top-level paragraph nodes, not by the "(N)"
     * marker in their text. Irregular source numbering can therefore return a node carrying a
     * different number.</p>
     *
     * @param label paragraph label
     * @param sectionNumber 1-based section position as digits
     * @return banner block of the section, empty when the paragraph or position does not exist
     */
    public Optional<String> findParagraphSection(String label, String sectionNumber) {
        Optional<Norm> norm = document.findParagraph(label);
        if (norm.isEmpty()) {
            return Optional.empty();
        }
        return sectionAt(norm.get(), sectionNumber)
                .map(paragraph -> formatter.formatSection(lawCode, norm.get(), sectionNumber, paragraph));
    }

    /**
     * Resolves a citation string such as "§ 8b Absatz 2" or "Art. 1 Abs. 2".
     *
     * @param reference citation text
     * @return formatted text, empty when the citation does not parse or resolve
     */
    public Optional<String> getByReference(String reference) {
        Optional<ParsedReference> parsed = LawReferenceParser.parse(reference);
        if (parsed.isEmpty()) {
            log.debug("No citation found in '{}'", reference);
            return Optional.empty();
        }
        return getByReference(parsed.get());
    }

    /**
     * Resolves a parsed citation.
     *
     * <p>Nummer, Buchstabe and Satz are not resolved individually: the whole Absatz is returned
     * with a note line naming the requested coordinates, or the whole paragraph when the citation
     * names no Absatz.</p>
     *
     * @param reference parsed citation
     * @return formatted text, empty when the paragraph or section does not exist
     */
    public Optional<String> getByReference(ParsedReference reference) {
        Optional<String> section = reference.absatz();
        if (section.isEmpty()) {
            return findParagraph(reference.paragraph());
        }
        Optional<String> formatted = findParagraphSection(reference.paragraph(), section.get());
        if (reference.hasFinerReference()) {
            return formatted.map(text -> formatter.withReferenceNote(text, reference));
        }
        return formatted;
    }

    /**
     * Searches every paragraph for a term and reports the first match of each.
     *
     * @param term text to look for
     * @param caseSensitive false to compare case-folded text
     * @return one hit per matching paragraph, in document order
     */
    public List<SearchHit> searchTerm(String term, boolean caseSensitive) {
        Objects.requireNonNull(term, "term");
        String wanted = caseSensitive ? term : LegalTextNormalizer.foldCase(term);
        List<SearchHit> hits = new ArrayList<>();
        for (Norm norm : document.paragraphs()) {
            String text = NormTextExtractor.normText(norm);
            if (text.isEmpty()) {
                continue;
            }
            String comparable = caseSensitive ? text : LegalTextNormalizer.foldCase(text);
            int matchIndex = comparable.indexOf(wanted);
            if (matchIndex < 0) {
                continue;
            }
            hits.add(new SearchHit(
                    norm.designation().orElseThrow(),
                    norm.title().orElse(""),
                    contextAround(text, matchIndex, term.length())));
        }
        log.debug("Term '{}' matched {} paragraphs in {}", term, hits.size(), lawCode);
        return hits;
    }

    /**
     * Lists every paragraph in document order. Structural headings are not included.
     */
    public List<ParagraphSummary> listAllParagraphs() {
        List<ParagraphSummary> summaries = new ArrayList<>();
        for (Norm norm : document.paragraphs()) {
            summaries.add(new ParagraphSummary(norm.designation().orElseThrow(), norm.title().orElse("")));
        }
        return summaries;
    }

    /**
     * Renders a paragraph body one Absatz per block with definition lists expanded.
     *
     * @param label paragraph label
     * @return structured text, empty when the paragraph does not exist
     */
    public Optional<String> formatParagraphContent(String label) {
        return document.findParagraph(label).map(formatter::formatNormContent);
    }

    /**
     * Returns a short overview of the law: title, abbreviations, counts and first paragraphs.
     */
    public String showInfo() {
        return formatter.lawInfo(lawCode, document);
    }

    private Optional<ParagraphNode> sectionAt(Norm norm, String sectionNumber) {
        int target;
        try {
            target = Integer.parseInt(sectionNumber.strip());
        } catch (NumberFormatException notNumeric) {
            log.debug("Section '{}' is not a number", sectionNumber);
            return Optional.empty();
        }
        Optional<TextBody> body = norm.textBody();
        if (target < 1 || body.isEmpty()) {
            return Optional.empty();
        }
        int position = 0;
        for (ContentNode node : body.get().elements()) {
            if (node instanceof ParagraphNode paragraph) {
                position++;
                if (position == target) {
                    return Optional.of(paragraph);
                }
            }
        }
        log.debug("{} {} has only {} sections, {} requested",
                lawCode, norm.designation().orElse("?"), position, target);
        return Optional.empty();
    }

    private String contextAround(String text, int matchIndex, int termLength) {
        int start = Math.max(0, matchIndex - contextChars);
        int end = Math.min(text.length(), matchIndex + termLength + contextChars);
        StringBuilder context = new StringBuilder();
        if (start > 0) {
            context.append(ELLIPSIS);
        }
        context.append(text, start, end);
        if (end < text.length()) {
            context.append(ELLIPSIS);
        }
        return context.toString();
    }
}
