package com.williamcallahan.lawsearch.domain.norm;

import java.util.Optional;

/**
 * One {@code norm} entry: a paragraph with text, or a structural heading used for the outline.
 *
 * @param buildDate builddate attribute, null when absent
 * @param documentNumber doknr attribute, null when absent
 * @param metadata parsed metadaten block, null when the norm has none
 * @param textData parsed textdaten block, null when the norm has none
 */
public record Norm(String buildDate, String documentNumber, NormMetadata metadata, NormTextData textData) {

    public Optional<NormMetadata> findMetadata() {
        return Optional.ofNullable(metadata);
    }

    /**
     * Returns the paragraph designation (enbez), such as "§ 8b" or "Art 1".
     */
    public Optional<String> designation() {
        return findMetadata().map(NormMetadata::designation);
    }

    /**
     * Returns the paragraph title (titel).
     */
    public Optional<String> title() {
        return findMetadata().map(NormMetadata::title);
    }

    public Optional<StructuralUnit> structuralUnit() {
        return findMetadata().map(NormMetadata::structuralUnit);
    }

    public boolean isParagraph() {
        return designation().isPresent();
    }

    public boolean isStructuralHeading() {
        return structuralUnit().isPresent();
    }

    /**
     * Returns the main text body (textdaten/text/Content), when the norm has one.
     */
    public Optional<TextBody> textBody() {
        return Optional.ofNullable(textData)
                .map(NormTextData::text)
                .map(NormText::content);
    }
}
