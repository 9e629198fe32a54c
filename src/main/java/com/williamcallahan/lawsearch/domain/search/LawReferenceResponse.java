package com.williamcallahan.lawsearch.domain.search;

/**
 * Response variants for a citation lookup.
 */
public sealed interface LawReferenceResponse permits LawReferenceOutcome, LookupErrorResponse {}
