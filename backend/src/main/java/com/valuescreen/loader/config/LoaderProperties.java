package com.valuescreen.loader.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "loader")
public class LoaderProperties {
    private static final String DEFAULT_USER_AGENT = "market-data-loader/0.1 (+contact)";
    private static final String DEFAULT_BASE_URL = "https://data.nasdaq.com/api/v3/datatables";

    private String userAgent;
    private Api api = new Api();
    private Stream stream = new Stream();
    private Db db = new Db();
    private Fundamentals fundamentals = new Fundamentals();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Stream getStream() {
        return stream;
    }

    public void setStream(Stream stream) {
        this.stream = stream;
    }

    public Db getDb() {
        return db;
    }

    public void setDb(Db db) {
        this.db = db;
    }

    public Fundamentals getFundamentals() {
        return fundamentals;
    }

    public void setFundamentals(Fundamentals fundamentals) {
        this.fundamentals = fundamentals;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Api {
        private String baseUrl = DEFAULT_BASE_URL;
        private String apiKey = "";
        private int requestsPerSecond = 2;
        private int requestTimeoutSeconds = 60;
        private int requestMaxAttempts = 3;
        private int requestRetryBaseDelayMs = 1000;
        private int requestRetryMaxDelayMs = 30000;
        private int tickerChunkSize = 100;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            if (baseUrl == null || baseUrl.isBlank()) {
                this.baseUrl = DEFAULT_BASE_URL;
                return;
            }
            String trimmed = baseUrl.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            this.baseUrl = trimmed;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey == null ? "" : apiKey.trim();
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public int getRequestsPerSecond() {
            return Math.max(1, requestsPerSecond);
        }

        public void setRequestsPerSecond(int requestsPerSecond) {
            this.requestsPerSecond = Math.max(1, requestsPerSecond);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getRequestMaxAttempts() {
            return Math.max(1, requestMaxAttempts);
        }

        public void setRequestMaxAttempts(int requestMaxAttempts) {
            this.requestMaxAttempts = Math.max(1, requestMaxAttempts);
        }

        public int getRequestRetryBaseDelayMs() {
            return requestRetryBaseDelayMs;
        }

        public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
            this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
        }

        public int getRequestRetryMaxDelayMs() {
            return requestRetryMaxDelayMs;
        }

        public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
            this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
        }

        public int getTickerChunkSize() {
            return Math.max(1, tickerChunkSize);
        }

        public void setTickerChunkSize(int tickerChunkSize) {
            this.tickerChunkSize = Math.max(1, tickerChunkSize);
        }
    }

    public static class Stream {
        private int fetchConcurrency = 5;
        private int writeConcurrency = 3;
        private int queueCapacity = 16;

        public int getFetchConcurrency() {
            return Math.max(1, fetchConcurrency);
        }

        public void setFetchConcurrency(int fetchConcurrency) {
            this.fetchConcurrency = Math.max(1, fetchConcurrency);
        }

        public int getWriteConcurrency() {
            return Math.max(1, writeConcurrency);
        }

        public void setWriteConcurrency(int writeConcurrency) {
            this.writeConcurrency = Math.max(1, writeConcurrency);
        }

        public int getQueueCapacity() {
            return Math.max(1, queueCapacity);
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = Math.max(1, queueCapacity);
        }
    }

    public static class Db {
        private int batchSize = 1000;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }
    }

    public static class Fundamentals {
        private String defaultDimensions = "ARQ,MRQ";

        public String getDefaultDimensions() {
            return defaultDimensions;
        }

        public void setDefaultDimensions(String defaultDimensions) {
            this.defaultDimensions = defaultDimensions == null || defaultDimensions.isBlank()
                ? "ARQ,MRQ"
                : defaultDimensions.trim();
        }
    }

    public static class Cli {
        private boolean run;
        private String tables = "tickers,fundamentals,daily,benchmarks";
        private String tickers = "";
        private boolean full;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getTables() {
            return tables;
        }

        public void setTables(String tables) {
            this.tables = tables == null ? "" : tables;
        }

        public String getTickers() {
            return tickers;
        }

        public void setTickers(String tickers) {
            this.tickers = tickers == null ? "" : tickers;
        }

        public boolean isFull() {
            return full;
        }

        public void setFull(boolean full) {
            this.full = full;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
