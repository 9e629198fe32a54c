package com.williamcallahan.lawsearch.service;

import com.williamcallahan.lawsearch.domain.norm.LawDocument;
import java.util.Optional;

/**
 * Supplies parsed law documents by law code.
 */
public interface LawDocumentLoader {

    /**
     * Loads and parses the law registered under the given code.
     *
     * @param lawCode law code such as "HGB"; resolution rules are up to the implementation
     * @return parsed document, empty when the law is unknown or cannot be read
     */
    Optional<LawDocument> load(String lawCode);
}
