package com.williamcallahan.lawsearch.domain.norm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.lawsearch.LawFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LawDocumentTest {

    private final LawDocument document = LawFixtures.musterLaw();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "§ 8b   | § 8b",
        "8b     | § 8b",
        "' 8b ' | § 8b",
        "§8     | § 8",
        "12     | § 12"
    })
    void findsParagraphIgnoringSectionSignAndWhitespace(String label, String expected) {
        assertEquals(expected, document.findParagraph(label).orElseThrow().designation().orElseThrow());
    }

    @Test
    void labelMatchingIsExact() {
        assertTrue(document.findParagraph("8c").isEmpty());
        assertEquals("§ 8", document.findParagraph("8").orElseThrow().designation().orElseThrow());
        assertTrue(document.findParagraph("1 ").isPresent());
        assertTrue(document.findParagraph("Abschnitt 1").isEmpty(), "Structural headings are not paragraphs");
        assertTrue(document.findParagraph(null).isEmpty());
    }

    @Test
    void labelsWithNoBreakSpacesMatch() {
        assertEquals("§ 8b", document.findParagraph("§\u00a08b\u00a0").orElseThrow().designation().orElseThrow());
        assertEquals("8b", LawDocument.normalizeLabel("\u00a0§\u00a08b"));
    }

    @Test
    void titleFallsBackToFirstNormTitle() {
        Norm first = new Norm(null, null, metadata(null, "Kurzer Titel"), null);
        LawDocument titled = new LawDocument(null, null, List.of(first));

        assertEquals("Kurzer Titel", titled.title().orElseThrow());
        assertTrue(new LawDocument(null, null, List.of()).title().isEmpty());
    }

    private static NormMetadata metadata(String longTitle, String title) {
        return new NormMetadata(List.of(), null, null, List.of(), null, longTitle, List.of(), null, title, null);
    }
}
