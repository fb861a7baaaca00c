package com.standings.harvester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT = "standings-harvester/0.1 (+contact)";

    private String userAgent;
    private int totalPages = 214849;
    private int concurrency = 50;
    private int workerThreads = 0;
    private int maxAttempts = 5;
    private int requestTimeoutSeconds = 30;
    private int connectTimeoutSeconds = 10;
    private int progressInterval = 10000;
    private Source source = new Source();
    private Retry retry = new Retry();
    private Output output = new Output();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getTotalPages() {
        return Math.max(0, totalPages);
    }

    public void setTotalPages(int totalPages) {
        this.totalPages = Math.max(0, totalPages);
    }

    public int getConcurrency() {
        return Math.max(1, concurrency);
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = Math.max(1, concurrency);
    }

    /**
     * Size of the run-scoped worker pool. Zero derives it from the concurrency limit.
     */
    public int getWorkerThreads() {
        return Math.max(0, workerThreads);
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = Math.max(0, workerThreads);
    }

    public int getMaxAttempts() {
        return Math.max(1, maxAttempts);
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getConnectTimeoutSeconds() {
        return Math.max(1, connectTimeoutSeconds);
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = Math.max(1, connectTimeoutSeconds);
    }

    public int getProgressInterval() {
        return Math.max(1, progressInterval);
    }

    public void setProgressInterval(int progressInterval) {
        this.progressInterval = Math.max(1, progressInterval);
    }

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
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

    public static class Source {
        private static final String DEFAULT_URL_TEMPLATE =
            "https://fantasy.premierleague.com/api/leagues-classic/{leagueId}/standings/?page_standings={page}";

        private String urlTemplate = DEFAULT_URL_TEMPLATE;
        private long leagueId = 314;

        public String getUrlTemplate() {
            return urlTemplate == null || urlTemplate.isBlank() ? DEFAULT_URL_TEMPLATE : urlTemplate.trim();
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }

        public long getLeagueId() {
            return leagueId;
        }

        public void setLeagueId(long leagueId) {
            this.leagueId = leagueId;
        }

        public String pageUrl(int pageNumber) {
            return getUrlTemplate()
                .replace("{leagueId}", String.valueOf(leagueId))
                .replace("{page}", String.valueOf(pageNumber));
        }
    }

    public static class Retry {
        private long rateLimitBaseMs = 5000;
        private long baseMs = 1000;
        private long maxDelayMs = 1_800_000;

        public long getRateLimitBaseMs() {
            return Math.max(0, rateLimitBaseMs);
        }

        public void setRateLimitBaseMs(long rateLimitBaseMs) {
            this.rateLimitBaseMs = Math.max(0, rateLimitBaseMs);
        }

        public long getBaseMs() {
            return Math.max(0, baseMs);
        }

        public void setBaseMs(long baseMs) {
            this.baseMs = Math.max(0, baseMs);
        }

        public long getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }
    }

    public static class Output {
        private String recordsPath = "player_data.json";
        private String failuresPath = "failed_attempts.json";

        public String getRecordsPath() {
            return recordsPath;
        }

        public void setRecordsPath(String recordsPath) {
            this.recordsPath = recordsPath;
        }

        public String getFailuresPath() {
            return failuresPath;
        }

        public void setFailuresPath(String failuresPath) {
            this.failuresPath = failuresPath;
        }
    }

    public static class Cli {
        private boolean run = true;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
