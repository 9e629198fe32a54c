package com.williamcallahan.lawsearch.domain.reference;

import java.util.Objects;
import java.util.Optional;

/**
 * Structured coordinates of a legal citation such as "BGB § 1 Absatz 1 Satz 1".
 *
 * <p>Only the paragraph is required; every other component is null when the citation did not
 * name it.</p>
 *
 * @param law law code preceding the paragraph marker, for example "BGB" or "KStG"
 * @param paragraph paragraph label: digits with an optional lowercase letter ("8b")
 * @param section Absatz number
 * @param number Nummer
 * @param letter Buchstabe, a single lowercase letter
 * @param sentence Satz number
 */
public record ParsedReference(
        String law, String paragraph, String section, String number, String letter, String sentence) {

    public ParsedReference {
        Objects.requireNonNull(paragraph, "paragraph");
        if (paragraph.isBlank()) {
            throw new IllegalArgumentException("paragraph must not be blank");
        }
    }

    public Optional<String> lawCode() {
        return Optional.ofNullable(law);
    }

    public Optional<String> absatz() {
        return Optional.ofNullable(section);
    }

    public Optional<String> nummer() {
        return Optional.ofNullable(number);
    }

    public Optional<String> buchstabe() {
        return Optional.ofNullable(letter);
    }

    public Optional<String> satz() {
        return Optional.ofNullable(sentence);
    }

    /**
     * Returns true when the citation points below Absatz level (Nummer, Buchstabe or Satz).
     */
    public boolean hasFinerReference() {
        return number != null || letter != null || sentence != null;
    }
}
