package com.williamcallahan.lawsearch.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.lawsearch.LawFixtures;
import com.williamcallahan.lawsearch.domain.content.CommentKind;
import com.williamcallahan.lawsearch.domain.content.CommentNode;
import com.williamcallahan.lawsearch.domain.content.ContentNode;
import com.williamcallahan.lawsearch.domain.content.DefinitionList;
import com.williamcallahan.lawsearch.domain.content.FileReference;
import com.williamcallahan.lawsearch.domain.content.FormatSpan;
import com.williamcallahan.lawsearch.domain.content.ParagraphNode;
import com.williamcallahan.lawsearch.domain.content.RevisionBlock;
import com.williamcallahan.lawsearch.domain.content.TextRun;
import com.williamcallahan.lawsearch.domain.norm.Norm;
import com.williamcallahan.lawsearch.domain.norm.NormText;
import com.williamcallahan.lawsearch.domain.norm.NormTextData;
import com.williamcallahan.lawsearch.domain.norm.TextBody;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Checks text reconstruction when the parser did not cache flattened text.
 */
class NormTextExtractorTest {

    @Test
    void prefersCachedBodyText() {
        Norm norm = LawFixtures.musterLaw().findParagraph("8").orElseThrow();

        assertEquals("(1) Das Register wird von den Gerichten geführt.", NormTextExtractor.normText(norm));
    }

    @Test
    void rebuildsBodyTextFromRunsAndParagraphsWhenNotCached() {
        TextBody body = new TextBody(null, List.of(
                new TextRun("Vorspann"),
                new ParagraphNode(null, List.of(), "(1) Erster Satz.", "1"),
                new FileReference("anlage.pdf", null, null, null)), null);

        assertEquals("Vorspann\n(1) Erster Satz.", NormTextExtractor.normText(normWith(body)));
    }

    @Test
    void normWithoutBodyHasNoText() {
        Norm heading = LawFixtures.musterLaw().structure().get(0);

        assertEquals("", NormTextExtractor.normText(heading));
        assertEquals("", NormTextExtractor.normText(new Norm(null, null, null, null)));
    }

    @Test
    void paragraphWithoutRawTextUsesOwnTextOfDirectChildren() {
        ParagraphNode paragraph = new ParagraphNode(null, List.of(
                new TextRun("Es gilt"),
                new FormatSpan("B", null, null, "fett", List.of()),
                new DefinitionList(null, null, null, null, List.of()),
                new TextRun("weiter.")), null, null);

        assertEquals("Es gilt fett weiter.", NormTextExtractor.paragraphText(paragraph));
    }

    @Test
    void elementsTextDescendsIntoSpansAndRevisionsButSkipsMedia() {
        List<ContentNode> nodes = List.of(
                new TextRun("Vorher"),
                new FormatSpan("B", null, null, null, List.of(new TextRun("innen"))),
                new RevisionBlock("R1", null, List.of(new TextRun("neu"))),
                new FileReference("a.pdf", null, null, null),
                new CommentNode(CommentKind.HINWEIS, "Hinweis"),
                new CommentNode(CommentKind.STAND, null));

        assertEquals("Vorher innen neu Hinweis", NormTextExtractor.elementsText(nodes));
    }

    private static Norm normWith(TextBody body) {
        return new Norm(null, null, null, new NormTextData(new NormText("XML", null, body, List.of()), null));
    }
}
