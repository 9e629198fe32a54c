package com.williamcallahan.lawsearch.service.markup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.lawsearch.domain.norm.CurrencyNote;
import com.williamcallahan.lawsearch.domain.norm.NormMetadata;
import com.williamcallahan.lawsearch.domain.norm.PublicationReference;
import java.time.LocalDate;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.Test;

class NormMetadataParserTest {

    private final NormMetadataParser parser = new NormMetadataParser();

    @Test
    void extractsEveryField() {
        NormMetadata metadata = parser.parse(metadaten("""
                <metadaten>
                  <jurabk> HGB </jurabk>
                  <jurabk>HdlGB</jurabk>
                  <amtabk>HGB</amtabk>
                  <ausfertigung-datum manuell="ja">1897-05-10</ausfertigung-datum>
                  <fundstelle typ="amtlich"><periodikum>RGBl</periodikum><zitstelle>1897, 219</zitstelle>
                    <anlageabgabe><anlagedat>1897-05-10</anlagedat><dokst>x</dokst></anlageabgabe></fundstelle>
                  <fundstelle typ="sonstig"><periodikum>BGBl III</periodikum></fundstelle>
                  <kurzue>Handelsgesetzbuch</kurzue>
                  <standangabe checked="nein"><standtyp>Stand</standtyp><standkommentar>geändert</standkommentar></standangabe>
                  <standangabe checked="vielleicht"><standtyp>Hinweis</standtyp></standangabe>
                  <enbez>§ 1</enbez>
                  <titel format="parat">Istkaufmann</titel>
                </metadaten>
                """));

        assertEquals(List.of("HGB", "HdlGB"), metadata.legalAbbreviations());
        assertEquals("HGB", metadata.officialAbbreviation());
        assertTrue(metadata.enactmentDate().manual());
        assertEquals(LocalDate.of(1897, 5, 10), metadata.enactmentDate().enactedOn().orElseThrow());
        PublicationReference official = metadata.publications().get(0);
        assertEquals("amtlich", official.type());
        assertEquals("1897, 219", official.citation());
        assertEquals("x", official.submission().documentStatus());
        assertNull(official.submission().deliveredOn());
        assertNull(metadata.publications().get(1).type(), "Unknown publication types are dropped");
        assertEquals("Handelsgesetzbuch", metadata.shortTitle());
        assertNull(metadata.longTitle());
        CurrencyNote unchecked = metadata.currencyNotes().get(0);
        assertEquals(Boolean.FALSE, unchecked.checked());
        assertEquals("geändert", unchecked.comment());
        assertTrue(metadata.currencyNotes().get(1).checkedFlag().isEmpty());
        assertEquals("§ 1", metadata.designation());
        assertEquals("Istkaufmann", metadata.title());
        assertNull(metadata.structuralUnit());
        assertFalse(metadata.isEmpty());
    }

    @Test
    void enactmentDateDefaultsToAutomaticAndToleratesBadDates() {
        NormMetadata metadata = parser.parse(metadaten(
                "<metadaten><ausfertigung-datum>10.05.1897</ausfertigung-datum></metadaten>"));

        assertFalse(metadata.enactmentDate().manual());
        assertTrue(metadata.enactmentDate().enactedOn().isEmpty());
    }

    @Test
    void publicationWithoutTypeKeepsItsFields() {
        NormMetadata metadata = parser.parse(metadaten(
                "<metadaten><fundstelle><periodikum>BGBl I</periodikum><zitstelle>2024, 5</zitstelle></fundstelle>"
                        + "<standangabe><standtyp>Stand</standtyp></standangabe></metadaten>"));

        PublicationReference publication = metadata.publications().get(0);
        assertNull(publication.type());
        assertEquals("BGBl I", publication.periodical());
        assertEquals("2024, 5", publication.citation());
        assertNull(publication.submission());
        assertNull(metadata.currencyNotes().get(0).checked());
    }

    @Test
    void emptyBlockYieldsEmptyMetadata() {
        NormMetadata metadata = parser.parse(metadaten("<metadaten><titel>   </titel></metadaten>"));

        assertTrue(metadata.legalAbbreviations().isEmpty());
        assertNull(metadata.title(), "Whitespace-only fields are absent");
        assertTrue(metadata.isEmpty());
    }

    private static Element metadaten(String xml) {
        return Jsoup.parse(xml, "", Parser.xmlParser()).children().first();
    }
}
