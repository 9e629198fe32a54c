package com.williamcallahan.lawsearch.domain.search;

import java.util.Objects;

/**
 * Label and title of one paragraph, used for listings.
 *
 * @param number paragraph designation as stored, for example "§ 1"
 * @param title paragraph title, empty when the paragraph has none
 */
public record ParagraphSummary(String number, String title) {

    public ParagraphSummary {
        Objects.requireNonNull(number, "number");
        title = title == null ? "" : title;
    }
}
