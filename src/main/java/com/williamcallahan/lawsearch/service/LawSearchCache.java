package com.williamcallahan.lawsearch.service;

import com.williamcallahan.lawsearch.config.AppProperties;
import com.williamcallahan.lawsearch.domain.norm.LawDocument;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps one {@link LawSearch} per law code for the lifetime of the process.
 *
 * <p>Entries are keyed by the upper-cased requested code, never evicted, and only created for
 * laws that load successfully. Not thread-safe: callers serving concurrent requests must
 * synchronize around it.</p>
 */
@Service
public class LawSearchCache {
    private static final Logger log = LoggerFactory.getLogger(LawSearchCache.class);

    private final Map<String, LawSearch> searches = new HashMap<>();
    private final LawDocumentLoader documentLoader;
    private final int contextChars;
    private final NormFormatter formatter;

    public LawSearchCache(LawDocumentLoader documentLoader, AppProperties appProperties) {
        this.documentLoader = documentLoader;
        this.contextChars = appProperties.getSearch().getContextChars();
        this.formatter = new NormFormatter(appProperties.getFormat().getRuleWidth());
    }

    /**
     * Returns the cached search for a law, loading the document on first use.
     *
     * <p>The search reports the law under the document's first legal abbreviation, falling back to
     * the upper-cased request code.</p>
     *
     * @param lawCode law code in any case
     * @return search over the law, empty when it cannot be loaded
     */
    public Optional<LawSearch> getSearch(String lawCode) {
        String key = lawCode.toUpperCase(Locale.ROOT);
        LawSearch cached = searches.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<LawDocument> document = documentLoader.load(lawCode);
        if (document.isEmpty()) {
            return Optional.empty();
        }
        List<String> abbreviations = document.get().abbreviations();
        String displayCode = abbreviations.isEmpty() ? key : abbreviations.get(0);
        LawSearch search = new LawSearch(document.get(), displayCode, contextChars, formatter);
        searches.put(key, search);
        log.info("Cached {} as {} ({} norms)", key, displayCode, document.get().norms().size());
        return Optional.of(search);
    }

    public boolean contains(String lawCode) {
        return searches.containsKey(lawCode.toUpperCase(Locale.ROOT));
    }

    public int size() {
        return searches.size();
    }
}
