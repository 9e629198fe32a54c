package com.williamcallahan.lawsearch.domain.norm;

/**
 * A {@code gliederungseinheit}: outline heading of a book, part, chapter or section.
 *
 * @param code gliederungskennzahl
 * @param label gliederungsbez, for example "Buch 1"
 * @param title gliederungstitel
 */
public record StructuralUnit(String code, String label, String title) {}
