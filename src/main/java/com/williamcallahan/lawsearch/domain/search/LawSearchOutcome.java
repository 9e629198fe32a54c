package com.williamcallahan.lawsearch.domain.search;

import java.util.List;
import java.util.Objects;

/**
 * Search hits within one law, capped by the caller's result limit.
 *
 * @param law law code as requested, upper-cased
 * @param term search term as requested
 * @param found number of hits returned
 * @param totalMatches number of hits before capping
 * @param results returned hits in document order
 */
public record LawSearchOutcome(String law, String term, int found, int totalMatches, List<SearchHit> results)
        implements LawSearchResponse {

    public LawSearchOutcome {
        Objects.requireNonNull(law, "Law code cannot be null");
        Objects.requireNonNull(term, "Search term cannot be null");
        results = List.copyOf(Objects.requireNonNull(results, "results"));
        if (found != results.size()) {
            throw new IllegalArgumentException("Found count must equal the number of results");
        }
        if (totalMatches < found) {
            throw new IllegalArgumentException("Total matches cannot be smaller than found");
        }
    }
}
