package com.deepansh.policyradar.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Strongly-typed configuration for the research engine.
 * Bound from application.yml under the "radar" prefix.
 */
@ConfigurationProperties(prefix = "radar")
@Data
public class RadarProperties {

    private Http http = new Http();
    private Providers providers = new Providers();
    private Fetch fetch = new Fetch();
    private Memory memory = new Memory();
    private Embedding embedding = new Embedding();
    private Sanitize sanitize = new Sanitize();
    private Orchestrator orchestrator = new Orchestrator();
    private Cancellation cancellation = new Cancellation();

    @Data
    public static class Http {
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 60000;
        private int maxConnections = 50;
        private int maxConnectionsPerRoute = 20;
    }

    @Data
    public static class Providers {
        /** api.data.gov key shared by Regulations.gov, GovInfo, Congress.gov and Data.gov */
        private String govApiKey = "";
        private String searchgovAffiliate = "";
        private String searchgovAccessKey = "";

        private String regulationsBaseUrl = "https://api.regulations.gov/v4";
        private String govinfoBaseUrl = "https://api.govinfo.gov";
        private String congressBaseUrl = "https://api.congress.gov/v3";
        private String federalRegisterBaseUrl = "https://www.federalregister.gov/api/v1";
        private String usaspendingBaseUrl = "https://api.usaspending.gov/api/v2";
        private String fiscalDataBaseUrl = "https://api.fiscaldata.treasury.gov/services/api/fiscal_service";
        private String datagovBaseUrl = "https://api.gsa.gov/technology/datagov/v3/action";
        private String dojBaseUrl = "https://www.justice.gov/api/v1";
        private String searchgovBaseUrl = "https://api.gsa.gov/technology/searchgov/v2";

        public boolean hasGovApiKey() {
            return govApiKey != null && !govApiKey.isBlank();
        }

        public boolean hasSearchGovCredentials() {
            return searchgovAffiliate != null && !searchgovAffiliate.isBlank()
                    && searchgovAccessKey != null && !searchgovAccessKey.isBlank();
        }
    }

    @Data
    public static class Fetch {
        /** Comma-separated allowlist. A leading dot matches any host with that suffix. Empty allows all. */
        private String allowedDomains = ".gov,.mil";
        private boolean allowLocalFetch = false;
        private long maxResponseBytes = 10_000_000L;
        private int defaultMaxLength = 15000;
        private String userAgent = "PolicyRadar/0.1";
        /** Render page images for PDFs that carry no text layer */
        private boolean extractPdfImages = false;

        public List<String> getAllowedDomainList() {
            if (allowedDomains == null || allowedDomains.isBlank()) return List.of();
            return Arrays.stream(allowedDomains.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .toList();
        }
    }

    @Data
    public static class Memory {
        /** mongo | in-memory */
        private String store = "mongo";
        private int chunkSize = 1200;
        private int chunkOverlap = 200;
        private int maxChunks = 500;
        private int topK = 5;
        private int embedBatchSize = 32;
        private String collectionPrefix = "pdf_memory_";
    }

    @Data
    public static class Embedding {
        /** local | openai | custom | gemini | huggingface */
        private String provider = "local";
        private String model = "hashing-384";
        private String apiKey = "";
        private String baseUrl = "";
        private int localDimensions = 384;
        private boolean cacheEnabled = true;
        private Duration cacheTtl = Duration.ofDays(7);
        /** Embedding clients kept alive at once; request-supplied keys each get one */
        private int maxCachedProviders = 64;
    }

    @Data
    public static class Sanitize {
        private int maxTextChars = 20000;
        private int maxImages = 2;
        private int maxImageBytes = 200_000;
        private int maxTotalImageBytes = 250_000;
        private int maxModelTextChars = 30000;
    }

    @Data
    public static class Orchestrator {
        private int maxIterations = 20;
        private int streamChunkSize = 50;
        private long streamDelayMs = 10;
    }

    @Data
    public static class Cancellation {
        private int maxEntries = 1000;
    }
}
