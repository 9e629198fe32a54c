package com.williamcallahan.lawsearch.domain.search;

/**
 * Response variants for a full-text search within one law.
 */
public sealed interface LawSearchResponse permits LawSearchOutcome, LookupErrorResponse {}
