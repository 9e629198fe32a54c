package com.williamcallahan.lawsearch.domain.norm;

import java.util.List;
import java.util.Objects;

/**
 * Flat descriptive fields of a norm (the {@code metadaten} block). Scalar components are null
 * when the source element is absent or empty.
 *
 * @param legalAbbreviations every {@code jurabk} value in source order, possibly empty
 * @param officialAbbreviation amtabk
 * @param enactmentDate ausfertigung-datum
 * @param publications every {@code fundstelle}
 * @param shortTitle kurzue
 * @param longTitle langue
 * @param currencyNotes every {@code standangabe}
 * @param designation enbez, the paragraph label
 * @param title titel
 * @param structuralUnit gliederungseinheit
 */
public record NormMetadata(
        List<String> legalAbbreviations,
        String officialAbbreviation,
        EnactmentDate enactmentDate,
        List<PublicationReference> publications,
        String shortTitle,
        String longTitle,
        List<CurrencyNote> currencyNotes,
        String designation,
        String title,
        StructuralUnit structuralUnit) {

    public NormMetadata {
        legalAbbreviations = List.copyOf(Objects.requireNonNull(legalAbbreviations, "legalAbbreviations"));
        publications = List.copyOf(Objects.requireNonNull(publications, "publications"));
        currencyNotes = List.copyOf(Objects.requireNonNull(currencyNotes, "currencyNotes"));
    }

    /**
     * Returns true when no field at all was populated; such norms can be skipped silently.
     */
    public boolean isEmpty() {
        return legalAbbreviations.isEmpty()
                && officialAbbreviation == null
                && enactmentDate == null
                && publications.isEmpty()
                && shortTitle == null
                && longTitle == null
                && currencyNotes.isEmpty()
                && designation == null
                && title == null
                && structuralUnit == null;
    }
}
