package com.williamcallahan.lawsearch.domain.search;

/**
 * Response variants for listing the paragraphs of one law.
 */
public sealed interface ParagraphListingResponse permits ParagraphListingOutcome, LookupErrorResponse {}
