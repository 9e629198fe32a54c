package com.williamcallahan.lawsearch.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.lawsearch.LawFixtures;
import com.williamcallahan.lawsearch.config.AppProperties;
import com.williamcallahan.lawsearch.domain.norm.LawDocument;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Ensures each law is loaded once per code and that failed loads are retried.
 */
class LawSearchCacheTest {

    private final LawDocumentLoader loader = mock(LawDocumentLoader.class);

    @Test
    void cachesSearchUnderUpperCasedCode() {
        when(loader.load("musterg")).thenReturn(Optional.of(LawFixtures.musterLaw()));
        LawSearchCache cache = new LawSearchCache(loader, new AppProperties());

        LawSearch first = cache.getSearch("musterg").orElseThrow();
        LawSearch second = cache.getSearch("MUSTERG").orElseThrow();

        assertSame(first, second);
        assertEquals("MusterG", first.lawCode(), "Display code is the first legal abbreviation");
        assertTrue(cache.contains("MusterG"));
        assertEquals(1, cache.size());
        verify(loader, times(1)).load("musterg");
    }

    @Test
    void fallsBackToUpperCasedCodeWithoutAbbreviations() {
        when(loader.load("xg")).thenReturn(Optional.of(new LawDocument(null, null, List.of())));
        LawSearchCache cache = new LawSearchCache(loader, new AppProperties());

        assertEquals("XG", cache.getSearch("xg").orElseThrow().lawCode());
    }

    @Test
    void failedLoadsAreNotCached() {
        when(loader.load("BGB")).thenReturn(Optional.empty());
        LawSearchCache cache = new LawSearchCache(loader, new AppProperties());

        assertTrue(cache.getSearch("BGB").isEmpty());
        assertTrue(cache.getSearch("BGB").isEmpty());

        assertFalse(cache.contains("BGB"));
        verify(loader, times(2)).load("BGB");
    }

    @Test
    void configuredOutputSettingsReachTheSearch() {
        AppProperties properties = new AppProperties();
        properties.getSearch().setContextChars(4);
        properties.getFormat().setRuleWidth(3);
        when(loader.load("MusterG")).thenReturn(Optional.of(LawFixtures.musterLaw()));
        LawSearch search = new LawSearchCache(loader, properties).getSearch("MusterG").orElseThrow();

        assertEquals("...Das Register wir...", search.searchTerm("Register", true).get(0).context());
        assertTrue(search.findParagraph("8").orElseThrow().startsWith("===\nMusterG § 8\n"));
    }
}
