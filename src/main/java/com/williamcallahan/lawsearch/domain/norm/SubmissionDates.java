package com.williamcallahan.lawsearch.domain.norm;

/**
 * The {@code anlageabgabe} sub-record of a publication reference.
 *
 * @param attachedOn anlagedat
 * @param documentStatus dokst
 * @param deliveredOn abgabedat
 */
public record SubmissionDates(String attachedOn, String documentStatus, String deliveredOn) {}
