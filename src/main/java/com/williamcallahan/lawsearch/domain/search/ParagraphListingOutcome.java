package com.williamcallahan.lawsearch.domain.search;

import java.util.List;
import java.util.Objects;

/**
 * Leading paragraphs of one law in document order.
 *
 * @param law law code as requested, upper-cased
 * @param total number of paragraphs in the law
 * @param shown number of paragraphs returned
 * @param paragraphs returned paragraphs
 */
public record ParagraphListingOutcome(String law, int total, int shown, List<ParagraphSummary> paragraphs)
        implements ParagraphListingResponse {

    public ParagraphListingOutcome {
        Objects.requireNonNull(law, "Law code cannot be null");
        paragraphs = List.copyOf(Objects.requireNonNull(paragraphs, "paragraphs"));
        if (shown != paragraphs.size()) {
            throw new IllegalArgumentException("Shown count must equal the number of paragraphs");
        }
    }
}
