package com.civilworks.carbon.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {
    /**
     * Root directory for every table the batch reads or writes, and for the cursor file.
     * Defaults to "data" when not set.
     */
    private String dataDir = "data";

    @Valid
    private Ingest ingest = new Ingest();
    @Valid
    private Fetch fetch = new Fetch();
    @Valid
    private Screening screening = new Screening();
    @Valid
    private Files files = new Files();

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Screening getScreening() {
        return screening;
    }

    public void setScreening(Screening screening) {
        this.screening = screening;
    }

    public Files getFiles() {
        return files;
    }

    public void setFiles(Files files) {
        this.files = files;
    }

    public static class Ingest {
        /** Base URL of the notices catalog. */
        @NotBlank
        private String baseUrl = "https://www.contractsfinder.service.gov.uk";
        /** Path of the OCDS search endpoint, relative to the base URL. */
        @NotBlank
        private String searchPath = "/Published/Notices/OCDS/Search";
        @Min(1)
        private int pageSize = 100;
        @NotBlank
        private String publishedFrom = "2025-01-01";
        @NotBlank
        private String publishedTo = "2025-12-31";
        /** Pause between two pages, in milliseconds. */
        @Min(0)
        private long pageDelayMs = 700;
        /** CPV prefixes accepted at ingestion time (construction works and engineering services). */
        private List<String> acceptedCpvPrefixes = new ArrayList<>(List.of("45", "71"));
        private int descriptionMaxLength = 500;
        private String defaultCurrency = "GBP";
        private String defaultCountry = "GB";
        private String sourceName = "UK Contracts Finder";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getSearchPath() {
            return searchPath;
        }

        public void setSearchPath(String searchPath) {
            this.searchPath = searchPath;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public String getPublishedFrom() {
            return publishedFrom;
        }

        public void setPublishedFrom(String publishedFrom) {
            this.publishedFrom = publishedFrom;
        }

        public String getPublishedTo() {
            return publishedTo;
        }

        public void setPublishedTo(String publishedTo) {
            this.publishedTo = publishedTo;
        }

        public long getPageDelayMs() {
            return pageDelayMs;
        }

        public void setPageDelayMs(long pageDelayMs) {
            this.pageDelayMs = pageDelayMs;
        }

        public List<String> getAcceptedCpvPrefixes() {
            return acceptedCpvPrefixes;
        }

        public void setAcceptedCpvPrefixes(List<String> acceptedCpvPrefixes) {
            this.acceptedCpvPrefixes = acceptedCpvPrefixes;
        }

        public int getDescriptionMaxLength() {
            return descriptionMaxLength;
        }

        public void setDescriptionMaxLength(int descriptionMaxLength) {
            this.descriptionMaxLength = descriptionMaxLength;
        }

        public String getDefaultCurrency() {
            return defaultCurrency;
        }

        public void setDefaultCurrency(String defaultCurrency) {
            this.defaultCurrency = defaultCurrency;
        }

        public String getDefaultCountry() {
            return defaultCountry;
        }

        public void setDefaultCountry(String defaultCountry) {
            this.defaultCountry = defaultCountry;
        }

        public String getSourceName() {
            return sourceName;
        }

        public void setSourceName(String sourceName) {
            this.sourceName = sourceName;
        }
    }

    public static class Fetch {
        /** Total time budget of a single GET, in seconds. */
        @Positive
        private long timeoutSeconds = 40;
        @Min(1)
        private int maxAttempts = 5;
        /** Backoff base; attempt n waits base * n seconds. */
        @Min(0)
        private long backoffBaseSeconds = 2;

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBackoffBaseSeconds() {
            return backoffBaseSeconds;
        }

        public void setBackoffBaseSeconds(long backoffBaseSeconds) {
            this.backoffBaseSeconds = backoffBaseSeconds;
        }
    }

    public static class Screening {
        /** Contracts below this spend are not screened. */
        private double minSpend = 5000;
        /** Strict civil-works CPV prefixes applied after ingestion. */
        private List<String> strictCpvPrefixes = new ArrayList<>(List.of("451", "4520", "4522", "4523", "4524", "4525"));
        /**
         * Filesystem path of the material reference table. When blank the bundled
         * classpath table is used.
         */
        private String materialReferencePath;
        /** Number of rows printed in the closing summary. */
        private int summaryTop = 5;

        public double getMinSpend() {
            return minSpend;
        }

        public void setMinSpend(double minSpend) {
            this.minSpend = minSpend;
        }

        public List<String> getStrictCpvPrefixes() {
            return strictCpvPrefixes;
        }

        public void setStrictCpvPrefixes(List<String> strictCpvPrefixes) {
            this.strictCpvPrefixes = strictCpvPrefixes;
        }

        public String getMaterialReferencePath() {
            return materialReferencePath;
        }

        public void setMaterialReferencePath(String materialReferencePath) {
            this.materialReferencePath = materialReferencePath;
        }

        public int getSummaryTop() {
            return summaryTop;
        }

        public void setSummaryTop(int summaryTop) {
            this.summaryTop = summaryTop;
        }
    }

    /** File names, resolved against {@code dataDir}. */
    public static class Files {
        private String ingested = "2025_construction_contracts.csv";
        private String cursor = "last_cursor.txt";
        private String strict = "2025_PURE_CIVIL_WORKS_STRICT.csv";
        private String cleaned = "2025_CIVIL_WORKS_CLEANED.csv";
        private String buyerMap = "buyer_canonical_map.csv";
        private String screened = "2025_CARBON_RISK_SCREENED.csv";

        public String getIngested() {
            return ingested;
        }

        public void setIngested(String ingested) {
            this.ingested = ingested;
        }

        public String getCursor() {
            return cursor;
        }

        public void setCursor(String cursor) {
            this.cursor = cursor;
        }

        public String getStrict() {
            return strict;
        }

        public void setStrict(String strict) {
            this.strict = strict;
        }

        public String getCleaned() {
            return cleaned;
        }

        public void setCleaned(String cleaned) {
            this.cleaned = cleaned;
        }

        public String getBuyerMap() {
            return buyerMap;
        }

        public void setBuyerMap(String buyerMap) {
            this.buyerMap = buyerMap;
        }

        public String getScreened() {
            return screened;
        }

        public void setScreened(String screened) {
            this.screened = screened;
        }
    }
}
