package com.williamcallahan.lawsearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Laws laws = new Laws();
    private Search search = new Search();
    private Format format = new Format();

    public Laws getLaws() {
        return laws;
    }

    public void setLaws(Laws laws) {
        this.laws = laws;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Format getFormat() {
        return format;
    }

    public void setFormat(Format format) {
        this.format = format;
    }

    /**
     * Locations of the law markup files and the code-to-file mapping.
     */
    public static class Laws {
        private String dataDir = "data";
        private String mappingFile = "law_mapping.json";

        public String getDataDir() { return dataDir; }
        public void setDataDir(String dataDir) { this.dataDir = dataDir; }

        public String getMappingFile() { return mappingFile; }
        public void setMappingFile(String mappingFile) { this.mappingFile = mappingFile; }
    }

    public static class Search {
        private int contextChars = 100;
        private int defaultMaxResults = 5;
        private int defaultParagraphLimit = 20;

        public int getContextChars() {
            return contextChars;
        }

        public void setContextChars(int contextChars) {
            this.contextChars = contextChars;
        }

        public int getDefaultMaxResults() {
            return defaultMaxResults;
        }

        public void setDefaultMaxResults(int defaultMaxResults) {
            this.defaultMaxResults = defaultMaxResults;
        }

        public int getDefaultParagraphLimit() {
            return defaultParagraphLimit;
        }

        public void setDefaultParagraphLimit(int defaultParagraphLimit) {
            this.defaultParagraphLimit = defaultParagraphLimit;
        }
    }

    public static class Format {
        private int ruleWidth = 70;

        public int getRuleWidth() { return ruleWidth; }
        public void setRuleWidth(int ruleWidth) { this.ruleWidth = ruleWidth; }
    }
}
