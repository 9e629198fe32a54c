package com.williamcallahan.lawsearch.domain.norm;

/**
 * A {@code fundstelle}: where the law was published.
 *
 * @param type "amtlich" or "nichtamtlich", null for anything else
 * @param periodical periodikum, for example "BGBl I"
 * @param citation zitstelle, for example "2002, 42"
 * @param submission anlageabgabe dates, null when absent
 */
public record PublicationReference(String type, String periodical, String citation, SubmissionDates submission) {}
