package com.williamcallahan.lawsearch.service.markup;

/**
 * Signals markup that cannot be parsed into a law document at all, such as a missing
 * {@code dokumente} root. Optional or malformed substructures never raise this.
 */
public class LawMarkupException extends IllegalArgumentException {

    /**
     * Creates a markup exception describing the structural problem.
     *
     * @param message failure summary
     */
    public LawMarkupException(String message) {
        super(message);
    }
}
