package com.williamcallahan.lawsearch.domain.norm;

import java.util.Optional;

/**
 * A {@code standangabe}: "as of" currency remark for the law text.
 *
 * @param checked true for checked="ja", false for "nein", null when absent or anything else
 * @param type standtyp, for example "Stand" or "Hinweis"
 * @param comment standkommentar
 */
public record CurrencyNote(Boolean checked, String type, String comment) {

    public Optional<Boolean> checkedFlag() {
        return Optional.ofNullable(checked);
    }
}
