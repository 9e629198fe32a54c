package com.williamcallahan.lawsearch.service;

import com.williamcallahan.lawsearch.config.AppProperties;
import com.williamcallahan.lawsearch.domain.mapping.LawMappingEntry;
import com.williamcallahan.lawsearch.domain.reference.ParsedReference;
import com.williamcallahan.lawsearch.domain.search.LawListingOutcome;
import com.williamcallahan.lawsearch.domain.search.LawReferenceOutcome;
import com.williamcallahan.lawsearch.domain.search.LawReferenceResponse;
import com.williamcallahan.lawsearch.domain.search.LawSearchOutcome;
import com.williamcallahan.lawsearch.domain.search.LawSearchResponse;
import com.williamcallahan.lawsearch.domain.search.LawSummary;
import com.williamcallahan.lawsearch.domain.search.LookupErrorResponse;
import com.williamcallahan.lawsearch.domain.search.ParagraphListingOutcome;
import com.williamcallahan.lawsearch.domain.search.ParagraphListingResponse;
import com.williamcallahan.lawsearch.domain.search.ParagraphSummary;
import com.williamcallahan.lawsearch.domain.search.SearchHit;
import com.williamcallahan.lawsearch.util.LawReferenceParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for tool and command-line layers: every operation takes plain strings and numbers
 * and answers with a result record. Misses come back as {@link LookupErrorResponse}.
 */
@Service
public class LawLookupService {
    private static final Logger log = LoggerFactory.getLogger(LawLookupService.class);

    private final LawSearchCache searchCache;
    private final LawMappingService mappingService;
    private final AppProperties appProperties;

    /**
     * Wires the facade.
     *
     * @param searchCache per-law search instances
     * @param mappingService source of the law listing
     * @param appProperties default result limits
     */
    public LawLookupService(LawSearchCache searchCache, LawMappingService mappingService, AppProperties appProperties) {
        this.searchCache = searchCache;
        this.mappingService = mappingService;
        this.appProperties = appProperties;
    }

    /**
     * Lists every law in the mapping, sorted by code.
     */
    public LawListingOutcome listLaws() {
        Map<String, LawMappingEntry> sorted = new TreeMap<>(mappingService.loadMapping());
        List<LawSummary> laws = new ArrayList<>();
        sorted.forEach((code, entry) -> laws.add(new LawSummary(code, entry.title(), entry.category())));
        return new LawListingOutcome(laws.size(), laws);
    }

    /**
     * Resolves a citation that names its law, such as "KStG § 8b Absatz 2".
     *
     * @param reference citation including the law code
     * @return formatted text, or an error when the code is missing, the law is unknown or the
     *     citation does not resolve
     */
    public LawReferenceResponse getByReference(String reference) {
        Optional<ParsedReference> parsed = LawReferenceParser.parse(reference);
        if (parsed.isEmpty() || parsed.get().lawCode().isEmpty()) {
            return new LookupErrorResponse(
                    "Reference must include law code (e.g., 'BGB § 1')", "Got: '" + reference + "'");
        }
        String lawCode = parsed.get().law();
        Optional<LawSearch> search = searchCache.getSearch(lawCode);
        if (search.isEmpty()) {
            return lawNotFound(lawCode);
        }
        Optional<String> text = search.get().getByReference(parsed.get());
        if (text.isEmpty()) {
            log.debug("Reference '{}' did not resolve", reference);
            return new LookupErrorResponse("Could not find or parse reference: '" + reference + "'", null);
        }
        return new LawReferenceOutcome(search.get().lawCode(), reference, text.get());
    }

    public LawSearchResponse searchLaw(String law, String term) {
        return searchLaw(law, term, appProperties.getSearch().getDefaultMaxResults());
    }

    /**
     * Searches one law case-insensitively.
     *
     * @param law law code in any case
     * @param term text to look for
     * @param maxResults maximum number of hits returned; negative values return none
     * @return capped hits with the uncapped total, or an error when the law is unknown
     */
    public LawSearchResponse searchLaw(String law, String term, int maxResults) {
        Optional<LawSearch> search = searchCache.getSearch(law);
        if (search.isEmpty()) {
            return lawNotFound(law);
        }
        List<SearchHit> hits = search.get().searchTerm(term, false);
        List<SearchHit> shown = hits.subList(0, clamp(maxResults, hits.size()));
        return new LawSearchOutcome(law.toUpperCase(Locale.ROOT), term, shown.size(), hits.size(), shown);
    }

    public ParagraphListingResponse listParagraphs(String law) {
        return listParagraphs(law, appProperties.getSearch().getDefaultParagraphLimit());
    }

    /**
     * Lists the leading paragraphs of one law in document order.
     *
     * @param law law code in any case
     * @param limit maximum number of paragraphs returned; negative values return none
     * @return paragraphs with the total count, or an error when the law is unknown
     */
    public ParagraphListingResponse listParagraphs(String law, int limit) {
        Optional<LawSearch> search = searchCache.getSearch(law);
        if (search.isEmpty()) {
            return lawNotFound(law);
        }
        List<ParagraphSummary> paragraphs = search.get().listAllParagraphs();
        List<ParagraphSummary> shown = paragraphs.subList(0, clamp(limit, paragraphs.size()));
        return new ParagraphListingOutcome(law.toUpperCase(Locale.ROOT), paragraphs.size(), shown.size(), shown);
    }

    private static LookupErrorResponse lawNotFound(String law) {
        log.warn("Law '{}' not found", law);
        return new LookupErrorResponse("Law '" + law + "' not found", null);
    }

    private static int clamp(int limit, int available) {
        return Math.max(0, Math.min(limit, available));
    }
}
