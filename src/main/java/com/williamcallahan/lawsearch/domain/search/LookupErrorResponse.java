package com.williamcallahan.lawsearch.domain.search;

import java.util.Objects;

/**
 * Describes why a lookup produced no result.
 */
public record LookupErrorResponse(String error, String details)
        implements LawReferenceResponse, LawSearchResponse, ParagraphListingResponse {

    public LookupErrorResponse {
        Objects.requireNonNull(error, "Error message cannot be null");
        details = details == null ? "" : details;
    }
}
