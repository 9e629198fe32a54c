package com.williamcallahan.lawsearch.domain.mapping;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the law mapping file, keyed by legal abbreviation.
 *
 * @param filename markup file name under the data directory
 * @param title full law title
 * @param category category such as "Gesetz" or "Verordnung"
 * @param builddate build date of the downloaded markup
 * @param urlPath path segment of the law on the publishing site
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LawMappingEntry(
        @JsonProperty("filename") String filename,
        @JsonProperty("title") String title,
        @JsonProperty("category") String category,
        @JsonProperty("builddate") String builddate,
        @JsonProperty("url_path") String urlPath) {}
