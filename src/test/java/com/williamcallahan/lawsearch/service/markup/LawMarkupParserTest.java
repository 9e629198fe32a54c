package com.williamcallahan.lawsearch.service.markup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.lawsearch.LawFixtures;
import com.williamcallahan.lawsearch.domain.content.DefinitionList;
import com.williamcallahan.lawsearch.domain.content.ParagraphNode;
import com.williamcallahan.lawsearch.domain.content.TableNode;
import com.williamcallahan.lawsearch.domain.content.TextRun;
import com.williamcallahan.lawsearch.domain.norm.Footnote;
import com.williamcallahan.lawsearch.domain.norm.LawDocument;
import com.williamcallahan.lawsearch.domain.norm.Norm;
import com.williamcallahan.lawsearch.domain.norm.NormText;
import com.williamcallahan.lawsearch.domain.norm.TextBody;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Parses the sample law end to end and checks the document-level structure.
 */
class LawMarkupParserTest {

    private final LawMarkupParser parser = new LawMarkupParser();

    @TempDir
    Path tempDir;

    @Test
    void parsesAllDirectNormsInSourceOrder() throws IOException {
        LawDocument document = parser.parse(LawFixtures.musterLawFile());

        assertEquals("20240301103015", document.buildDate());
        assertEquals("BJNR000110024", document.documentNumber());
        assertEquals(7, document.norms().size());
        assertEquals(
                List.of("§ 1", "§ 8", "§ 8b", "§ 10", "§ 12"),
                document.paragraphs().stream().map(norm -> norm.designation().orElseThrow()).toList());
        assertEquals(1, document.structure().size());
        assertEquals(List.of("MusterG", "MustRegG"), document.abbreviations());
        assertEquals("Gesetz über die Führung des Musterregisters", document.title().orElseThrow());
    }

    @Test
    void parsingTheSameMarkupTwiceYieldsEqualDocuments() throws IOException {
        String xml = Files.readString(LawFixtures.musterLawFile());

        assertEquals(parser.parse(xml), parser.parse(xml));
        assertEquals(parser.parse(xml), parser.parse(LawFixtures.musterLawFile()));
    }

    @Test
    void paragraphBodiesKeepOnlyParagraphNodesBetweenWhitespace() {
        Norm norm = LawFixtures.musterLaw().findParagraph("8b").orElseThrow();

        TextBody body = norm.textBody().orElseThrow();
        assertEquals(3, body.elements().size());
        ParagraphNode first = assertInstanceOf(ParagraphNode.class, body.elements().get(0));
        assertEquals("1", first.absatzNumber());
        assertEquals(new TextRun("(1) Das Unternehmensregister wird elektronisch geführt."), first.children().get(0));
        assertEquals(new TextRun(" Es enthält folgende Angaben:"), first.children().get(1));
        DefinitionList list = assertInstanceOf(DefinitionList.class, first.children().get(2));
        assertEquals(2, list.items().size());
        assertEquals(
                "(1) Das Unternehmensregister wird elektronisch geführt. Es enthält folgende Angaben: "
                        + "1. Eintragungen im Handelsregister, 2. Bekanntmachungen a) der Gerichte, b) der Behörden.",
                first.rawText());
        assertTrue(body.rawText().endsWith("(3) Näheres regelt eine Rechtsverordnung."));
    }

    @Test
    void readsFootnotesAndFootnoteTextBlocks() {
        LawDocument document = LawFixtures.musterLaw();
        NormText text = document.findParagraph("§ 8b").orElseThrow().textData().text();

        assertEquals("XML", text.format());
        assertNull(text.tableOfContents());
        Footnote footnote = text.footnotes().get(0);
        assertEquals("F1", footnote.id());
        assertEquals("1", footnote.marker());
        assertEquals("(", footnote.prefix());
        assertEquals(")", footnote.postfix());
        assertInstanceOf(ParagraphNode.class, footnote.content().get(0));

        NormText footnoteText = document.norms().get(0).textData().footnoteText();
        assertEquals("(+++ Textnachweis ab: 15.1.2024 +++)", footnoteText.content().rawText());
    }

    @Test
    void tablesInsideParagraphsAreParsed() {
        Norm norm = LawFixtures.musterLaw().findParagraph("10").orElseThrow();

        ParagraphNode second = (ParagraphNode) norm.textBody().orElseThrow().elements().get(1);
        TableNode table = assertInstanceOf(TableNode.class, second.children().get(1));
        assertEquals("Gebührentabelle", table.title());
        assertEquals(2, table.groups().get(0).body().size());
        assertNull(table.groups().get(0).body().get(1).entries().get(0).moreRows());
    }

    @Test
    void normsWithoutTextKeepAnEmptyBody() {
        Norm heading = LawFixtures.musterLaw().structure().get(0);

        assertFalse(heading.isParagraph());
        assertTrue(heading.textBody().isEmpty());
        assertEquals("Abschnitt 1", heading.structuralUnit().orElseThrow().label());
    }

    @Test
    void rejectsMarkupWithoutDocumentRoot() {
        assertThrows(LawMarkupException.class, () -> parser.parse("<?xml version=\"1.0\"?>"));
        LawMarkupException foreignRoot =
                assertThrows(LawMarkupException.class, () -> parser.parse("<gesetz><norm/></gesetz>"));
        assertTrue(foreignRoot.getMessage().contains("gesetz"));
    }

    @Test
    void emptyDocumentRootYieldsNoNorms() {
        LawDocument document = parser.parse("<dokumente builddate=\"1\"><unbekannt/></dokumente>");

        assertTrue(document.norms().isEmpty());
        assertTrue(document.title().isEmpty());
        assertTrue(document.abbreviations().isEmpty());
    }

    @Test
    void missingFileSurfacesAsIOException() {
        assertThrows(IOException.class, () -> parser.parse(tempDir.resolve("fehlt.xml")));
    }
}
