package com.williamcallahan.lawsearch.domain.search;

import java.util.Objects;

/**
 * Formatted text resolved for a citation.
 *
 * @param lawCode code of the law the citation was resolved against
 * @param reference citation as requested
 * @param text banner-formatted paragraph or Absatz text
 */
public record LawReferenceOutcome(String lawCode, String reference, String text) implements LawReferenceResponse {

    public LawReferenceOutcome {
        Objects.requireNonNull(lawCode, "Law code cannot be null");
        Objects.requireNonNull(reference, "Reference cannot be null");
        Objects.requireNonNull(text, "Resolved text cannot be null");
    }
}
