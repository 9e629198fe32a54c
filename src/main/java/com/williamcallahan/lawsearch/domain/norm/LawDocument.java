package com.williamcallahan.lawsearch.domain.norm;

import com.williamcallahan.lawsearch.util.LegalTextNormalizer;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed law: the {@code dokumente} root with all of its norms in source order.
 *
 * <p>Built once per parse and read-only afterwards. Document-level title and abbreviations are
 * taken from the first norm only.</p>
 *
 * @param buildDate builddate attribute of the root, null when absent
 * @param documentNumber doknr attribute of the root, null when absent
 * @param norms norms in source order
 */
public record LawDocument(String buildDate, String documentNumber, List<Norm> norms) {

    public LawDocument {
        norms = List.copyOf(Objects.requireNonNull(norms, "norms"));
    }

    /**
     * Returns the law title: the first norm's long title, else its title.
     */
    public Optional<String> title() {
        return firstNormMetadata().flatMap(metadata -> {
            if (metadata.longTitle() != null) {
                return Optional.of(metadata.longTitle());
            }
            return Optional.ofNullable(metadata.title());
        });
    }

    /**
     * Returns the legal abbreviations (jurabk) of the first norm, in source order.
     */
    public List<String> abbreviations() {
        return firstNormMetadata().map(NormMetadata::legalAbbreviations).orElse(List.of());
    }

    /**
     * Returns norms carrying a paragraph designation, in document order.
     */
    public List<Norm> paragraphs() {
        return norms.stream().filter(Norm::isParagraph).toList();
    }

    /**
     * Returns norms carrying a structural unit (book, part, chapter, section headings).
     */
    public List<Norm> structure() {
        return norms.stream().filter(Norm::isStructuralHeading).toList();
    }

    /**
     * Finds the first paragraph whose designation equals the given label.
     *
     * <p>Both sides are compared after removing the section sign and surrounding whitespace, so
     * "§ 8b" and "8b " are equivalent while "8" never matches "8b".</p>
     *
     * @param label paragraph label with or without section sign
     * @return first matching norm in document order
     */
    public Optional<Norm> findParagraph(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String wanted = normalizeLabel(label);
        return paragraphs().stream()
                .filter(norm -> norm.designation().map(LawDocument::normalizeLabel).filter(wanted::equals).isPresent())
                .findFirst();
    }

    /**
     * Strips the section sign and surrounding whitespace from a paragraph label.
     *
     * @param label raw label such as "§ 8b"
     * @return normalized label such as "8b"
     */
    public static String normalizeLabel(String label) {
        return LegalTextNormalizer.trim(label.replace("§", ""));
    }

    private Optional<NormMetadata> firstNormMetadata() {
        if (norms.isEmpty()) {
            return Optional.empty();
        }
        return norms.get(0).findMetadata();
    }
}
