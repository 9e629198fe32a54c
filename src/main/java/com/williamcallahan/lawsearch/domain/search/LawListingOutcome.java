package com.williamcallahan.lawsearch.domain.search;

import java.util.List;
import java.util.Objects;

/**
 * All laws known to the mapping, sorted by code.
 */
public record LawListingOutcome(int total, List<LawSummary> laws) {

    public LawListingOutcome {
        laws = List.copyOf(Objects.requireNonNull(laws, "laws"));
        if (total < 0) {
            throw new IllegalArgumentException("Total must be non-negative");
        }
    }
}
