package com.williamcallahan.lawsearch.service.markup;

import static com.williamcallahan.lawsearch.service.markup.MarkupElements.attribute;
import static com.williamcallahan.lawsearch.service.markup.MarkupElements.children;
import static com.williamcallahan.lawsearch.service.markup.MarkupElements.firstChild;

import com.williamcallahan.lawsearch.domain.norm.LawDocument;
import com.williamcallahan.lawsearch.domain.norm.Norm;
import com.williamcallahan.lawsearch.domain.norm.NormText;
import com.williamcallahan.lawsearch.domain.norm.NormTextData;
import com.williamcallahan.lawsearch.domain.norm.TextBody;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Parses gii-norm XML into a {@link LawDocument}.
 *
 * <p>Markup is read with jsoup's XML parser so tag and attribute case is preserved. Only a missing
 * or foreign root element is fatal; every optional substructure that is absent simply leaves its
 * field empty.</p>
 */
@Service
public class LawMarkupParser {
    private static final Logger log = LoggerFactory.getLogger(LawMarkupParser.class);

    private static final String ROOT_TAG = "dokumente";

    private final ContentElementParser contentParser = new ContentElementParser();
    private final NormMetadataParser metadataParser = new NormMetadataParser();

    /**
     * Reads and parses a law file.
     *
     * @param file XML file on disk
     * @return parsed document
     * @throws IOException when the file cannot be read
     * @throws LawMarkupException when the file has no {@code dokumente} root
     */
    public LawDocument parse(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Document markup;
        try (InputStream input = Files.newInputStream(file)) {
            markup = Jsoup.parse(input, StandardCharsets.UTF_8.name(), "", Parser.xmlParser());
        }
        LawDocument document = parse(markup);
        log.debug("Parsed {} norms from {}", document.norms().size(), file.getFileName());
        return document;
    }

    /**
     * Parses markup held in memory.
     *
     * @param xml complete XML document text
     * @return parsed document
     * @throws LawMarkupException when the markup has no {@code dokumente} root
     */
    public LawDocument parse(String xml) {
        Objects.requireNonNull(xml, "xml");
        return parse(Jsoup.parse(xml, "", Parser.xmlParser()));
    }

    /**
     * Parses an already built element tree.
     *
     * @param markup document produced by jsoup's XML parser
     * @return parsed document
     * @throws LawMarkupException when the root element is missing or is not {@code dokumente}
     */
    public LawDocument parse(Document markup) {
        Element root = markup.children().first();
        if (root == null) {
            throw new LawMarkupException("Markup has no root element");
        }
        if (!ROOT_TAG.equals(root.tagName())) {
            throw new LawMarkupException(
                    "Expected <" + ROOT_TAG + "> root element but found <" + root.tagName() + ">");
        }
        List<Norm> norms = new ArrayList<>();
        for (Element norm : children(root, "norm")) {
            norms.add(parseNorm(norm));
        }
        return new LawDocument(attribute(root, "builddate"), attribute(root, "doknr"), norms);
    }

    private Norm parseNorm(Element norm) {
        return new Norm(
                attribute(norm, "builddate"),
                attribute(norm, "doknr"),
                firstChild(norm, "metadaten").map(metadataParser::parse).orElse(null),
                firstChild(norm, "textdaten").map(this::parseTextData).orElse(null));
    }

    private NormTextData parseTextData(Element textData) {
        return new NormTextData(
                firstChild(textData, "text").map(this::parseTextBlock).orElse(null),
                firstChild(textData, "fussnoten").map(this::parseTextBlock).orElse(null));
    }

    private NormText parseTextBlock(Element block) {
        return new NormText(
                attribute(block, "format"),
                firstChild(block, "TOC").map(contentParser::parseTableOfContents).orElse(null),
                firstChild(block, "Content").map(this::parseTextBody).orElse(null),
                firstChild(block, "Footnotes").map(contentParser::parseFootnotes).orElse(List.of()));
    }

    private TextBody parseTextBody(Element content) {
        return new TextBody(
                attribute(content, "ID"), contentParser.parseContent(content), MarkupElements.flattenText(content));
    }
}
