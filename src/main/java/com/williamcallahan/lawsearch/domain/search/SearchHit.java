package com.williamcallahan.lawsearch.domain.search;

import java.util.Objects;

/**
 * A paragraph whose text contains a search term.
 *
 * @param paragraph paragraph designation as stored, for example "§ 8b"
 * @param title paragraph title, empty when the paragraph has none
 * @param context text around the first match; "..." marks each side that was cut off
 */
public record SearchHit(String paragraph, String title, String context) {

    public SearchHit {
        Objects.requireNonNull(paragraph, "paragraph");
        title = title == null ? "" : title;
        Objects.requireNonNull(context, "context");
    }
}
