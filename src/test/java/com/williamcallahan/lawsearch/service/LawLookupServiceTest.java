package com.williamcallahan.lawsearch.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.lawsearch.LawFixtures;
import com.williamcallahan.lawsearch.config.AppProperties;
import com.williamcallahan.lawsearch.domain.search.LawListingOutcome;
import com.williamcallahan.lawsearch.domain.search.LawReferenceOutcome;
import com.williamcallahan.lawsearch.domain.search.LawSearchOutcome;
import com.williamcallahan.lawsearch.domain.search.LawSummary;
import com.williamcallahan.lawsearch.domain.search.LookupErrorResponse;
import com.williamcallahan.lawsearch.domain.search.ParagraphListingOutcome;
import com.williamcallahan.lawsearch.domain.search.ParagraphSummary;
import com.williamcallahan.lawsearch.domain.search.SearchHit;
import com.williamcallahan.lawsearch.service.markup.LawMarkupParser;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Runs the facade against the sample mapping and law files.
 */
class LawLookupServiceTest {

    private LawLookupService lookupService;

    @BeforeEach
    void setUp() {
        AppProperties properties = LawFixtures.appProperties();
        LawMappingService mappingService = new LawMappingService(properties);
        LawSearchCache cache = new LawSearchCache(
                new MappedLawDocumentLoader(mappingService, new LawMarkupParser(), properties), properties);
        lookupService = new LawLookupService(cache, mappingService, properties);
    }

    @Test
    void listsLawsSortedByCode() {
        LawListingOutcome listing = lookupService.listLaws();

        assertEquals(3, listing.total());
        assertEquals(List.of("AktG", "KStG 1977", "MusterG"), listing.laws().stream().map(LawSummary::code).toList());
        assertEquals("Aktiengesetz", listing.laws().get(0).title());
    }

    @Test
    void resolvesReferenceWithLawCode() {
        LawReferenceOutcome outcome =
                assertInstanceOf(LawReferenceOutcome.class, lookupService.getByReference("MusterG § 8b Absatz 2"));

        assertEquals("MusterG", outcome.lawCode());
        assertEquals("MusterG § 8b Absatz 2", outcome.reference());
        assertTrue(outcome.text().endsWith("(2) Zugänglich sind: jede Person."));
    }

    @Test
    void referenceWithoutLawCodeIsRejected() {
        LookupErrorResponse error = assertInstanceOf(LookupErrorResponse.class, lookupService.getByReference("§ 1"));

        assertEquals("Reference must include law code (e.g., 'BGB § 1')", error.error());
        assertEquals("Got: '§ 1'", error.details());
        assertInstanceOf(LookupErrorResponse.class, lookupService.getByReference("irgendwas"));
    }

    @Test
    void referenceToUnknownLawOrParagraphReportsError() {
        LookupErrorResponse unknownLaw =
                assertInstanceOf(LookupErrorResponse.class, lookupService.getByReference("BGB § 1"));
        LookupErrorResponse missingFile =
                assertInstanceOf(LookupErrorResponse.class, lookupService.getByReference("KStG § 8b"));
        LookupErrorResponse unknownParagraph =
                assertInstanceOf(LookupErrorResponse.class, lookupService.getByReference("MusterG § 99"));

        assertEquals("Law 'BGB' not found", unknownLaw.error());
        assertEquals("Law 'KStG' not found", missingFile.error());
        assertEquals("Could not find or parse reference: 'MusterG § 99'", unknownParagraph.error());
        assertEquals("", unknownParagraph.details());
    }

    @Test
    void searchCapsHitsButReportsTotal() {
        LawSearchOutcome all = assertInstanceOf(LawSearchOutcome.class, lookupService.searchLaw("musterg", "register"));
        LawSearchOutcome capped =
                assertInstanceOf(LawSearchOutcome.class, lookupService.searchLaw("musterg", "register", 2));

        assertEquals("MUSTERG", all.law());
        assertEquals("register", all.term());
        assertEquals(4, all.found());
        assertEquals(4, all.totalMatches());
        assertEquals(2, capped.found());
        assertEquals(4, capped.totalMatches());
        assertEquals(List.of("§ 1", "§ 8"), capped.results().stream().map(SearchHit::paragraph).toList());
    }

    @Test
    void negativeLimitsReturnNothing() {
        LawSearchOutcome search =
                assertInstanceOf(LawSearchOutcome.class, lookupService.searchLaw("MusterG", "register", -1));
        ParagraphListingOutcome listing =
                assertInstanceOf(ParagraphListingOutcome.class, lookupService.listParagraphs("MusterG", -3));

        assertEquals(0, search.found());
        assertEquals(4, search.totalMatches());
        assertEquals(0, listing.shown());
        assertEquals(5, listing.total());
    }

    @Test
    void listsLeadingParagraphs() {
        ParagraphListingOutcome limited =
                assertInstanceOf(ParagraphListingOutcome.class, lookupService.listParagraphs("MusterG", 2));
        ParagraphListingOutcome defaults =
                assertInstanceOf(ParagraphListingOutcome.class, lookupService.listParagraphs("musterg"));

        assertEquals("MUSTERG", limited.law());
        assertEquals(List.of(
                new ParagraphSummary("§ 1", "Anwendungsbereich"),
                new ParagraphSummary("§ 8", "Registerführung")), limited.paragraphs());
        assertEquals(5, defaults.shown());
    }

    @Test
    void unknownLawIsReportedForSearchAndListing() {
        assertEquals(
                new LookupErrorResponse("Law 'XYZ' not found", null),
                lookupService.searchLaw("XYZ", "a"));
        assertEquals(
                new LookupErrorResponse("Law 'XYZ' not found", null),
                lookupService.listParagraphs("XYZ"));
    }
}
