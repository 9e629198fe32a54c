package com.williamcallahan.lawsearch.domain.norm;

import java.time.LocalDate;
import java.util.Optional;

/**
 * The {@code ausfertigung-datum} element.
 *
 * @param manual true when manuell="ja"; an absent attribute means "nein"
 * @param date parsed ISO date, null when missing or unparseable
 */
public record EnactmentDate(boolean manual, LocalDate date) {

    public Optional<LocalDate> enactedOn() {
        return Optional.ofNullable(date);
    }
}
