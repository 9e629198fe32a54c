package com.williamcallahan.lawsearch.service.markup;

import static com.williamcallahan.lawsearch.service.markup.MarkupElements.attribute;
import static com.williamcallahan.lawsearch.service.markup.MarkupElements.children;
import static com.williamcallahan.lawsearch.service.markup.MarkupElements.firstChild;
import static com.williamcallahan.lawsearch.service.markup.MarkupElements.flattenText;
import static com.williamcallahan.lawsearch.service.markup.MarkupElements.leadingText;
import static com.williamcallahan.lawsearch.service.markup.MarkupElements.tailText;

import com.williamcallahan.lawsearch.domain.content.ColumnSpec;
import com.williamcallahan.lawsearch.domain.content.CommentKind;
import com.williamcallahan.lawsearch.domain.content.CommentNode;
import com.williamcallahan.lawsearch.domain.content.ContentNode;
import com.williamcallahan.lawsearch.domain.content.DefinitionDescription;
import com.williamcallahan.lawsearch.domain.content.DefinitionItem;
import com.williamcallahan.lawsearch.domain.content.DefinitionList;
import com.williamcallahan.lawsearch.domain.content.DefinitionTerm;
import com.williamcallahan.lawsearch.domain.content.FileReference;
import com.williamcallahan.lawsearch.domain.content.FootnoteArea;
import com.williamcallahan.lawsearch.domain.content.FormatSpan;
import com.williamcallahan.lawsearch.domain.content.ImageNode;
import com.williamcallahan.lawsearch.domain.content.ListParagraph;
import com.williamcallahan.lawsearch.domain.content.ParagraphNode;
import com.williamcallahan.lawsearch.domain.content.PreformattedText;
import com.williamcallahan.lawsearch.domain.content.RevisionBlock;
import com.williamcallahan.lawsearch.domain.content.TableEntry;
import com.williamcallahan.lawsearch.domain.content.TableGroup;
import com.williamcallahan.lawsearch.domain.content.TableNode;
import com.williamcallahan.lawsearch.domain.content.TableOfContents;
import com.williamcallahan.lawsearch.domain.content.TableRow;
import com.williamcallahan.lawsearch.domain.content.TextRun;
import com.williamcallahan.lawsearch.domain.norm.Footnote;
import com.williamcallahan.lawsearch.util.LegalTextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns mixed-content markup into the content node tree.
 *
 * <p>Every container is handled the same way: normalized leading text becomes a text run, then each
 * child element is parsed by tag and followed by its normalized tail. Footnote markers are
 * dropped while their tails are kept.</p>
 */
public final class ContentElementParser {
    private static final Logger log = LoggerFactory.getLogger(ContentElementParser.class);

    private static final Pattern ABSATZ_MARKER = Pattern.compile("^\\((\\d+[a-z]?)\\)");
    private static final int ABSATZ_PREFIX_LENGTH = 10;
    private static final int DEFAULT_COLUMN_COUNT = 1;

    private static final Set<String> LIST_PARAGRAPH_SIZES = Set.of("normal", "small", "tiny");
    private static final Set<String> FOOTNOTE_AREA_LINES = Set.of("0", "1");
    private static final Set<String> FOOTNOTE_AREA_SIZES = Set.of("normal", "large", "small");
    private static final String DEFAULT_FOOTNOTE_AREA_LINE = "1";
    private static final String DEFAULT_FOOTNOTE_AREA_SIZE = "normal";

    private static final String[] ID_ATTRIBUTE = {"ID", "Id", "id"};
    private static final String[] CLASS_ATTRIBUTE = {"Class", "class"};

    /**
     * Parses the mixed content of a container element.
     *
     * @param container element whose text and children are parsed
     * @return content nodes in document order
     */
    public List<ContentNode> parseContent(Element container) {
        List<ContentNode> nodes = new ArrayList<>();
        String leading = LegalTextNormalizer.trim(LegalTextNormalizer.normalizeWhitespace(leadingText(container)));
        if (!leading.isEmpty()) {
            nodes.add(new TextRun(leading));
        }
        for (Element child : container.children()) {
            if (!MarkupElements.isFootnoteMarker(child)) {
                parseElement(child).ifPresent(nodes::add);
            }
            String tail = LegalTextNormalizer.normalizeWhitespace(tailText(child));
            if (!tail.isEmpty() && !" ".equals(tail)) {
                nodes.add(new TextRun(tail));
            }
        }
        return nodes;
    }

    /**
     * Parses one element by tag. Unrecognized tags degrade to their flattened text.
     *
     * @param element element to parse
     * @return parsed node, empty when an unrecognized element holds no text
     */
    public Optional<ContentNode> parseElement(Element element) {
        MarkupTag tag = MarkupTag.fromTagName(element.tagName());
        switch (tag) {
            case P:
                return Optional.of(parseParagraph(element));
            case DL:
                return Optional.of(parseDefinitionList(element));
            case TABLE:
                return Optional.of(parseTable(element));
            case IMG:
                return Optional.of(parseImage(element));
            case FILE:
                return Optional.of(new FileReference(
                        attribute(element, "SRC"),
                        attribute(element, "PREVIEW"),
                        attribute(element, "Type"),
                        attribute(element, "title")));
            case FN_AREA:
                return Optional.of(parseFootnoteArea(element));
            case TOC:
                return Optional.of(parseTableOfContents(element));
            case KOMMENTAR:
                return Optional.of(parseComment(element));
            case PRE:
                return Optional.of(new PreformattedText(flattenText(element)));
            case REVISION:
                return Optional.of(parseRevision(element));
            case BR:
                return Optional.of(TextRun.lineBreak());
            case BOLD:
            case ITALIC:
            case UNDERLINE:
            case SUPERSCRIPT:
            case SUBSCRIPT:
            case SPACED:
            case SMALL:
            case CITATION:
                return Optional.of(parseFormatSpan(element));
            case UNKNOWN:
            default:
                return parseUnknown(element);
        }
    }

    /**
     * Parses a {@code P} element, keeping its flattened text and Absatz number.
     */
    public ParagraphNode parseParagraph(Element paragraph) {
        String rawText = flattenText(paragraph);
        return new ParagraphNode(
                attribute(paragraph, ID_ATTRIBUTE), parseContent(paragraph), rawText, extractAbsatzNumber(rawText));
    }

    /**
     * Parses a {@code TOC} element.
     */
    public TableOfContents parseTableOfContents(Element toc) {
        return new TableOfContents(attribute(toc, ID_ATTRIBUTE), parseContent(toc));
    }

    /**
     * Parses the {@code Footnote} children of a {@code Footnotes} block.
     */
    public List<Footnote> parseFootnotes(Element footnotes) {
        List<Footnote> parsed = new ArrayList<>();
        for (Element footnote : children(footnotes, "Footnote")) {
            parsed.add(new Footnote(
                    attribute(footnote, ID_ATTRIBUTE),
                    attribute(footnote, "Prefix"),
                    attribute(footnote, "FnZ"),
                    attribute(footnote, "Postfix"),
                    attribute(footnote, "Pos"),
                    attribute(footnote, "Group"),
                    parseContent(footnote)));
        }
        return parsed;
    }

    /**
     * Reads the Absatz number from a leading "(N)" or "(Na)" marker.
     *
     * @param rawText flattened paragraph text
     * @return number token, or null when the text does not start with a marker
     */
    static String extractAbsatzNumber(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return null;
        }
        String prefix = rawText.substring(0, Math.min(ABSATZ_PREFIX_LENGTH, rawText.length()));
        Matcher matcher = ABSATZ_MARKER.matcher(prefix);
        return matcher.find() ? matcher.group(1) : null;
    }

    private DefinitionList parseDefinitionList(Element list) {
        List<DefinitionItem> items = new ArrayList<>();
        DefinitionTerm pendingTerm = null;
        for (Element child : list.children()) {
            String tagName = child.tagName();
            if ("DT".equals(tagName)) {
                if (pendingTerm != null) {
                    log.debug("Dropping definition term without description: {}", pendingTerm.text());
                }
                pendingTerm = new DefinitionTerm(
                        attribute(child, ID_ATTRIBUTE), LegalTextNormalizer.trim(flattenText(child)));
            } else if ("DD".equals(tagName)) {
                if (pendingTerm == null) {
                    log.debug("Dropping definition description without term");
                    continue;
                }
                items.add(new DefinitionItem(pendingTerm, parseDescription(child)));
                pendingTerm = null;
            }
        }
        return new DefinitionList(
                attribute(list, ID_ATTRIBUTE),
                attribute(list, "Indent"),
                attribute(list, "Font"),
                attribute(list, "Type"),
                items);
    }

    private DefinitionDescription parseDescription(Element description) {
        ListParagraph listParagraph =
                firstChild(description, "LA").map(this::parseListParagraph).orElse(null);
        List<RevisionBlock> revisions = new ArrayList<>();
        for (Element revision : children(description, MarkupTag.REVISION.tagName())) {
            revisions.add(parseRevision(revision));
        }
        return new DefinitionDescription(attribute(description, ID_ATTRIBUTE), listParagraph, revisions);
    }

    private ListParagraph parseListParagraph(Element listParagraph) {
        String size = attribute(listParagraph, "Size");
        String restrictedSize = size != null && LIST_PARAGRAPH_SIZES.contains(size) ? size : null;
        boolean hasChildElements = !listParagraph.children().isEmpty();
        return new ListParagraph(
                attribute(listParagraph, ID_ATTRIBUTE),
                restrictedSize,
                attribute(listParagraph, "Value"),
                hasChildElements ? null : flattenText(listParagraph),
                hasChildElements ? parseContent(listParagraph) : List.of());
    }

    private TableNode parseTable(Element table) {
        String title = firstChild(table, "Title").map(MarkupElements::leadingText).orElse(null);
        List<TableGroup> groups = new ArrayList<>();
        for (Element group : children(table, "tgroup")) {
            groups.add(parseTableGroup(group));
        }
        return new TableNode(
                attribute(table, ID_ATTRIBUTE),
                attribute(table, "frame"),
                attribute(table, "colsep"),
                attribute(table, "rowsep"),
                title,
                groups);
    }

    private TableGroup parseTableGroup(Element group) {
        Integer declaredColumns = parseInteger(attribute(group, "cols"));
        List<ColumnSpec> columnSpecs = new ArrayList<>();
        for (Element spec : children(group, "colspec")) {
            columnSpecs.add(new ColumnSpec(
                    attribute(spec, "colname"),
                    parseInteger(attribute(spec, "colnum")),
                    attribute(spec, "colwidth"),
                    attribute(spec, "align"),
                    attribute(spec, "colsep"),
                    attribute(spec, "rowsep")));
        }
        List<TableRow> header = firstChild(group, "thead").map(this::parseRows).orElse(null);
        List<TableRow> body = firstChild(group, "tbody").map(this::parseRows).orElse(List.of());
        List<TableRow> footer = firstChild(group, "tfoot").map(this::parseRows).orElse(null);
        return new TableGroup(
                declaredColumns == null ? DEFAULT_COLUMN_COUNT : declaredColumns, columnSpecs, header, body, footer);
    }

    private List<TableRow> parseRows(Element rowGroup) {
        List<TableRow> rows = new ArrayList<>();
        for (Element row : children(rowGroup, "row")) {
            List<TableEntry> entries = new ArrayList<>();
            for (Element entry : children(row, "entry")) {
                entries.add(new TableEntry(
                        attribute(entry, ID_ATTRIBUTE),
                        attribute(entry, "align"),
                        attribute(entry, "valign"),
                        attribute(entry, "colname"),
                        attribute(entry, "namest"),
                        attribute(entry, "nameend"),
                        parseInteger(attribute(entry, "morerows")),
                        attribute(entry, "colsep"),
                        attribute(entry, "rowsep"),
                        parseContent(entry)));
            }
            rows.add(new TableRow(
                    attribute(row, ID_ATTRIBUTE),
                    attribute(row, "rowsep"),
                    attribute(row, "valign"),
                    entries));
        }
        return rows;
    }

    private ImageNode parseImage(Element image) {
        return new ImageNode(
                attribute(image, "SRC", "Src", "src"),
                attribute(image, "alt"),
                attribute(image, "title"),
                attribute(image, "orient"),
                attribute(image, "Pos"),
                attribute(image, "Align"),
                attribute(image, "Size"),
                attribute(image, "Width"),
                attribute(image, "Height"),
                attribute(image, "Units"),
                attribute(image, "Type"));
    }

    private FootnoteArea parseFootnoteArea(Element area) {
        String line = attribute(area, "Line");
        String size = attribute(area, "Size");
        List<String> referenceIds = new ArrayList<>();
        for (Element reference : children(area, "FnR")) {
            String referenceId = attribute(reference, ID_ATTRIBUTE);
            referenceIds.add(referenceId == null ? "" : referenceId);
        }
        return new FootnoteArea(
                line != null && FOOTNOTE_AREA_LINES.contains(line) ? line : DEFAULT_FOOTNOTE_AREA_LINE,
                size != null && FOOTNOTE_AREA_SIZES.contains(size) ? size : DEFAULT_FOOTNOTE_AREA_SIZE,
                referenceIds);
    }

    private CommentNode parseComment(Element comment) {
        CommentKind kind = CommentKind.fromMarkup(attribute(comment, "typ")).orElse(CommentKind.HINWEIS);
        String text = leadingText(comment);
        return new CommentNode(kind, text.isEmpty() ? null : text);
    }

    private RevisionBlock parseRevision(Element revision) {
        return new RevisionBlock(
                attribute(revision, ID_ATTRIBUTE), attribute(revision, "Postfix"), parseContent(revision));
    }

    private FormatSpan parseFormatSpan(Element span) {
        String text = leadingText(span);
        return new FormatSpan(
                span.tagName(),
                attribute(span, ID_ATTRIBUTE),
                attribute(span, CLASS_ATTRIBUTE),
                text.isEmpty() ? null : text,
                parseContent(span));
    }

    private Optional<ContentNode> parseUnknown(Element element) {
        String text = flattenText(element);
        log.debug("Unrecognized element <{}> reduced to text ({} chars)", element.tagName(), text.length());
        return text.isEmpty() ? Optional.empty() : Optional.of(new TextRun(text));
    }

    private static Integer parseInteger(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.strip());
        } catch (NumberFormatException notNumeric) {
            log.debug("Ignoring non-numeric attribute value '{}'", value);
            return null;
        }
    }
}
