package com.williamcallahan.lawsearch.service.markup;

import static com.williamcallahan.lawsearch.service.markup.MarkupElements.allChildTexts;
import static com.williamcallahan.lawsearch.service.markup.MarkupElements.attribute;
import static com.williamcallahan.lawsearch.service.markup.MarkupElements.childText;
import static com.williamcallahan.lawsearch.service.markup.MarkupElements.children;
import static com.williamcallahan.lawsearch.service.markup.MarkupElements.firstChild;
import static com.williamcallahan.lawsearch.service.markup.MarkupElements.leadingText;

import com.williamcallahan.lawsearch.domain.norm.CurrencyNote;
import com.williamcallahan.lawsearch.domain.norm.EnactmentDate;
import com.williamcallahan.lawsearch.domain.norm.NormMetadata;
import com.williamcallahan.lawsearch.domain.norm.PublicationReference;
import com.williamcallahan.lawsearch.domain.norm.StructuralUnit;
import com.williamcallahan.lawsearch.domain.norm.SubmissionDates;
import com.williamcallahan.lawsearch.util.LegalTextNormalizer;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the {@code metadaten} block of a norm.
 */
public final class NormMetadataParser {
    private static final Logger log = LoggerFactory.getLogger(NormMetadataParser.class);

    private static final Set<String> PUBLICATION_TYPES = Set.of("amtlich", "nichtamtlich");
    private static final String MANUAL_FLAG = "ja";
    private static final String DEFAULT_MANUAL_FLAG = "nein";

    /**
     * Extracts every metadata field. Missing children simply leave their field empty.
     *
     * @param metadata the {@code metadaten} element
     * @return parsed metadata
     */
    public NormMetadata parse(Element metadata) {
        return new NormMetadata(
                allChildTexts(metadata, "jurabk"),
                childText(metadata, "amtabk"),
                firstChild(metadata, "ausfertigung-datum").map(this::parseEnactmentDate).orElse(null),
                parsePublications(metadata),
                childText(metadata, "kurzue"),
                childText(metadata, "langue"),
                parseCurrencyNotes(metadata),
                childText(metadata, "enbez"),
                childText(metadata, "titel"),
                firstChild(metadata, "gliederungseinheit").map(this::parseStructuralUnit).orElse(null));
    }

    private EnactmentDate parseEnactmentDate(Element element) {
        String manualFlag = attribute(element, "manuell");
        boolean manual = MANUAL_FLAG.equals(manualFlag == null ? DEFAULT_MANUAL_FLAG : manualFlag);
        String text = LegalTextNormalizer.trim(leadingText(element));
        LocalDate date = null;
        if (!text.isEmpty()) {
            try {
                date = LocalDate.parse(text);
            } catch (DateTimeParseException invalidDate) {
                log.debug("Ignoring invalid enactment date '{}'", text);
            }
        }
        return new EnactmentDate(manual, date);
    }

    private List<PublicationReference> parsePublications(Element metadata) {
        List<PublicationReference> publications = new ArrayList<>();
        for (Element publication : children(metadata, "fundstelle")) {
            String type = attribute(publication, "typ");
            SubmissionDates submission = firstChild(publication, "anlageabgabe")
                    .map(dates -> new SubmissionDates(
                            childText(dates, "anlagedat"), childText(dates, "dokst"), childText(dates, "abgabedat")))
                    .orElse(null);
            publications.add(new PublicationReference(
                    type != null && PUBLICATION_TYPES.contains(type) ? type : null,
                    childText(publication, "periodikum"),
                    childText(publication, "zitstelle"),
                    submission));
        }
        return publications;
    }

    private List<CurrencyNote> parseCurrencyNotes(Element metadata) {
        List<CurrencyNote> notes = new ArrayList<>();
        for (Element note : children(metadata, "standangabe")) {
            String checked = attribute(note, "checked");
            Boolean checkedFlag =
                    "ja".equals(checked) ? Boolean.TRUE : "nein".equals(checked) ? Boolean.FALSE : null;
            notes.add(new CurrencyNote(
                    checkedFlag, childText(note, "standtyp"), childText(note, "standkommentar")));
        }
        return notes;
    }

    private StructuralUnit parseStructuralUnit(Element unit) {
        return new StructuralUnit(
                childText(unit, "gliederungskennzahl"),
                childText(unit, "gliederungsbez"),
                childText(unit, "gliederungstitel"));
    }
}
