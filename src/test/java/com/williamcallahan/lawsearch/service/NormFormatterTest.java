package com.williamcallahan.lawsearch.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.lawsearch.LawFixtures;
import com.williamcallahan.lawsearch.domain.content.DefinitionDescription;
import com.williamcallahan.lawsearch.domain.content.DefinitionItem;
import com.williamcallahan.lawsearch.domain.content.DefinitionList;
import com.williamcallahan.lawsearch.domain.content.DefinitionTerm;
import com.williamcallahan.lawsearch.domain.content.ListParagraph;
import com.williamcallahan.lawsearch.domain.content.TextRun;
import com.williamcallahan.lawsearch.domain.norm.LawDocument;
import com.williamcallahan.lawsearch.domain.norm.Norm;
import com.williamcallahan.lawsearch.domain.reference.ParsedReference;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies banner layout, the reference note and structured Absatz rendering.
 */
class NormFormatterTest {

    private static final String RULE = "=".repeat(70);

    private final NormFormatter formatter = new NormFormatter();
    private final LawDocument document = LawFixtures.musterLaw();

    @Test
    void formatsParagraphWithTitleBanner() {
        String formatted = formatter.formatParagraph("MusterG", paragraph("8"));

        assertEquals(String.join("\n",
                RULE,
                "MusterG § 8",
                "Registerführung",
                RULE,
                "",
                "(1) Das Register wird von den Gerichten geführt."), formatted);
    }

    @Test
    void omitsTitleLineWhenParagraphHasNoTitle() {
        String formatted = formatter.formatParagraph("MusterG", paragraph("12"));

        assertEquals(String.join("\n",
                RULE,
                "MusterG § 12",
                RULE,
                "",
                "Dieses Gesetz tritt am Tag nach der Verkündung in Kraft."), formatted);
    }

    @Test
    void normWithoutMetadataFormatsToEmptyText() {
        assertEquals("", formatter.formatParagraph("MusterG", new Norm(null, null, null, null)));
    }

    @Test
    void ruleWidthIsConfigurable() {
        String formatted = new NormFormatter(10).formatParagraph("MusterG", paragraph("8"));

        assertTrue(formatted.startsWith("==========\nMusterG § 8\n"));
        assertThrows(IllegalArgumentException.class, () -> new NormFormatter(0));
    }

    @Test
    void referenceNoteGoesBelowTheBanner() {
        String section = String.join("\n", RULE, "MusterG § 8b Absatz 1", RULE, "", "(1) Text.");
        ParsedReference reference = new ParsedReference("MusterG", "8b", "1", "2", "a", "3");

        assertEquals(String.join("\n",
                RULE,
                "MusterG § 8b Absatz 1",
                RULE,
                "(Gesucht: Nummer 2 Buchstabe a Satz 3)",
                "",
                "(1) Text."), formatter.withReferenceNote(section, reference));
    }

    @Test
    void referenceWithoutFinerCoordinatesLeavesTextUnchanged() {
        ParsedReference reference = new ParsedReference(null, "8b", "1", null, null, null);

        assertEquals("unverändert", formatter.withReferenceNote("unverändert", reference));
    }

    @Test
    void lawInfoSummarizesCountsAndFirstParagraphs() {
        String info = formatter.lawInfo("MusterG", document);

        assertEquals(String.join("\n",
                RULE,
                "MusterG: Gesetz über die Führung des Musterregisters",
                RULE,
                "Abbreviations: MusterG, MustRegG",
                "Total norms:   7",
                "Paragraphs:    5",
                "Structure:     1 elements",
                "",
                "First 5 paragraphs:",
                "  § 1             Anwendungsbereich",
                "  § 8             Registerführung",
                "  § 8b            Unternehmensregister",
                "  § 10            Gebühren",
                "  § 12            "), info);
    }

    @Test
    void rendersAbsaetzeWithNestedDefinitionLists() {
        String content = formatter.formatNormContent(paragraph("8b"));

        assertEquals(String.join("\n",
                "(1) Das Unternehmensregister wird elektronisch geführt. Es enthält folgende Angaben:",
                "1. Eintragungen im Handelsregister,",
                "2. Bekanntmachungen",
                "  a) der Gerichte,",
                "  b) der Behörden.",
                "",
                "(2) Zugänglich sind: jede Person.",
                "",
                "(3) Näheres regelt eine Rechtsverordnung."), content);
    }

    @Test
    void paragraphsWithoutMarkerAreRenderedVerbatim() {
        assertEquals(
                "Dieses Gesetz tritt am Tag nach der Verkündung in Kraft.",
                formatter.formatNormContent(paragraph("12")));
        assertEquals("", formatter.formatNormContent(document.structure().get(0)));
    }

    @Test
    void definitionItemsWithoutListParagraphAreSkipped() {
        DefinitionList list = new DefinitionList(null, null, null, null, List.of(
                item("1.", null),
                item("2.", new ListParagraph(null, null, null, null, List.of(new TextRun("aus Kindern")))),
                item("3.", new ListParagraph(null, null, null, "flach", List.of()))));

        assertEquals(List.of("    2. aus Kindern", "    3. flach"), formatter.definitionListLines(list, 2));
    }

    private Norm paragraph(String label) {
        return document.findParagraph(label).orElseThrow();
    }

    private static DefinitionItem item(String term, ListParagraph body) {
        return new DefinitionItem(new DefinitionTerm(null, term), new DefinitionDescription(null, body, List.of()));
    }
}
