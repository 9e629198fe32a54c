package com.williamcallahan.lawsearch.domain.search;

import java.util.Objects;

/**
 * One available law as listed from the law mapping.
 */
public record LawSummary(String code, String title, String category) {

    public LawSummary {
        Objects.requireNonNull(code, "code");
        title = title == null ? "" : title;
        category = category == null ? "" : category;
    }
}
