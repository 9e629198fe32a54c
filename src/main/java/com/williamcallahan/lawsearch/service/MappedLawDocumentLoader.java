package com.williamcallahan.lawsearch.service;

import com.williamcallahan.lawsearch.config.AppProperties;
import com.williamcallahan.lawsearch.domain.mapping.LawMappingEntry;
import com.williamcallahan.lawsearch.domain.norm.LawDocument;
import com.williamcallahan.lawsearch.service.markup.LawMarkupException;
import com.williamcallahan.lawsearch.service.markup.LawMarkupParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Loads laws from the data directory, using the law mapping to find the markup file.
 */
@Service
public class MappedLawDocumentLoader implements LawDocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(MappedLawDocumentLoader.class);

    private final LawMappingService mappingService;
    private final LawMarkupParser markupParser;
    private final Path dataDir;

    /**
     * Wires the loader against the configured data directory.
     *
     * @param mappingService resolves law codes to markup files
     * @param markupParser parses the markup files
     * @param appProperties supplies the data directory
     */
    @Autowired
    public MappedLawDocumentLoader(
            LawMappingService mappingService, LawMarkupParser markupParser, AppProperties appProperties) {
        this(mappingService, markupParser, Path.of(appProperties.getLaws().getDataDir()));
    }

    MappedLawDocumentLoader(LawMappingService mappingService, LawMarkupParser markupParser, Path dataDir) {
        this.mappingService = mappingService;
        this.markupParser = markupParser;
        this.dataDir = dataDir;
    }

    @Override
    public Optional<LawDocument> load(String lawCode) {
        Optional<Map.Entry<String, LawMappingEntry>> resolved = mappingService.resolve(lawCode);
        if (resolved.isEmpty()) {
            log.warn("Law '{}' not found in mapping", lawCode);
            return Optional.empty();
        }
        String filename = resolved.get().getValue().filename();
        if (filename == null || filename.isBlank()) {
            log.warn("Mapping entry '{}' names no markup file", resolved.get().getKey());
            return Optional.empty();
        }
        Path markupFile = dataDir.resolve(filename);
        if (!Files.isRegularFile(markupFile)) {
            log.error("XML file not found: {}", markupFile);
            return Optional.empty();
        }
        try {
            return Optional.of(markupParser.parse(markupFile));
        } catch (IOException | LawMarkupException e) {
            log.error("Error parsing {}: {}", markupFile, e.getMessage());
            return Optional.empty();
        }
    }
}
