package com.williamcallahan.lawsearch.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.lawsearch.config.AppProperties;
import com.williamcallahan.lawsearch.domain.mapping.LawMappingEntry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Reads the law mapping file, a JSON object from legal abbreviation to markup file details.
 *
 * <p>The mapping is read on every call so edits to the file are picked up without a restart.
 * A missing or unreadable file yields an empty mapping.</p>
 */
@Service
public class LawMappingService {
    private static final Logger log = LoggerFactory.getLogger(LawMappingService.class);
    private static final TypeReference<LinkedHashMap<String, LawMappingEntry>> MAPPING_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path mappingFile;

    @Autowired
    public LawMappingService(AppProperties appProperties) {
        this(Path.of(appProperties.getLaws().getMappingFile()));
    }

    LawMappingService(Path mappingFile) {
        this.mappingFile = mappingFile;
    }

    /**
     * Loads the mapping in file order.
     *
     * @return mapping from law code to entry, empty when the file is missing or malformed
     */
    public Map<String, LawMappingEntry> loadMapping() {
        if (!Files.isRegularFile(mappingFile)) {
            log.warn("Law mapping file not found: {}", mappingFile.toAbsolutePath());
            return Collections.emptyMap();
        }
        try (InputStream in = Files.newInputStream(mappingFile)) {
            Map<String, LawMappingEntry> mapping = mapper.readValue(in, MAPPING_TYPE);
            if (mapping == null) {
                return Collections.emptyMap();
            }
            log.debug("Loaded {} laws from {}", mapping.size(), mappingFile);
            return Collections.unmodifiableMap(mapping);
        } catch (IOException e) {
            log.error("Error loading law mapping {}: {}", mappingFile, e.getMessage());
            return Collections.emptyMap();
        }
    }

    /**
     * Resolves a law code against the current mapping file.
     *
     * @param lawCode code as typed by the user, for example "kstg"
     * @return mapping key and entry, empty when nothing matches
     */
    public Optional<Map.Entry<String, LawMappingEntry>> resolve(String lawCode) {
        Map<String, LawMappingEntry> mapping = loadMapping();
        return findLawKey(lawCode, mapping).map(key -> Map.entry(key, mapping.get(key)));
    }

    /**
     * Finds the mapping key for a law code.
     *
     * <p>Tried in order: exact key, case-insensitive key, key starting with the code followed by
     * a space or underscore ("KStG" finds "KStG 1977"), and finally any key starting with the code.
     * Each step scans the mapping in file order.</p>
     *
     * @param lawCode code to resolve
     * @param mapping mapping to search
     * @return matching key
     */
    public static Optional<String> findLawKey(String lawCode, Map<String, LawMappingEntry> mapping) {
        if (lawCode == null || lawCode.isEmpty()) {
            return Optional.empty();
        }
        if (mapping.containsKey(lawCode)) {
            return Optional.of(lawCode);
        }
        String wanted = lawCode.toUpperCase(Locale.ROOT);
        for (String key : mapping.keySet()) {
            if (key.toUpperCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(key);
            }
        }
        for (String key : mapping.keySet()) {
            String upperKey = key.toUpperCase(Locale.ROOT);
            if (upperKey.startsWith(wanted + " ") || upperKey.startsWith(wanted + "_")) {
                return Optional.of(key);
            }
        }
        for (String key : mapping.keySet()) {
            if (key.toUpperCase(Locale.ROOT).startsWith(wanted)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
