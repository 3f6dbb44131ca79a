package com.kinoscope.metadata.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "resolver")
public class ResolverProperties {
    private static final List<String> DEFAULT_USER_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/123.0.0.0 Safari/537.36 Edg/123.0.0.0",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36"
    );

    private List<String> userAgents = new ArrayList<>(DEFAULT_USER_AGENTS);
    private int minRequestDelayMs = 1000;
    private int maxRequestDelayMs = 3000;
    private int softBlockRetryDelayMs = 2000;
    private int requestTimeoutSeconds = 20;
    private int maxResolutionSeconds = 300;
    private int globalConcurrency = 2;
    private Imdb imdb = new Imdb();
    private Tmdb tmdb = new Tmdb();
    private Cli cli = new Cli();

    public List<String> getUserAgents() {
        return normalizeUserAgents(userAgents);
    }

    public void setUserAgents(List<String> userAgents) {
        this.userAgents = normalizeUserAgents(userAgents);
    }

    public int getMinRequestDelayMs() {
        return Math.max(0, minRequestDelayMs);
    }

    public void setMinRequestDelayMs(int minRequestDelayMs) {
        this.minRequestDelayMs = Math.max(0, minRequestDelayMs);
    }

    public int getMaxRequestDelayMs() {
        return Math.max(getMinRequestDelayMs(), maxRequestDelayMs);
    }

    public void setMaxRequestDelayMs(int maxRequestDelayMs) {
        this.maxRequestDelayMs = Math.max(0, maxRequestDelayMs);
    }

    public int getSoftBlockRetryDelayMs() {
        return Math.max(0, softBlockRetryDelayMs);
    }

    public void setSoftBlockRetryDelayMs(int softBlockRetryDelayMs) {
        this.softBlockRetryDelayMs = Math.max(0, softBlockRetryDelayMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getMaxResolutionSeconds() {
        return maxResolutionSeconds;
    }

    public void setMaxResolutionSeconds(int maxResolutionSeconds) {
        this.maxResolutionSeconds = maxResolutionSeconds;
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public Imdb getImdb() {
        return imdb;
    }

    public void setImdb(Imdb imdb) {
        this.imdb = imdb;
    }

    public Tmdb getTmdb() {
        return tmdb;
    }

    public void setTmdb(Tmdb tmdb) {
        this.tmdb = tmdb;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static List<String> normalizeUserAgents(List<String> candidates) {
        if (candidates == null) {
            return DEFAULT_USER_AGENTS;
        }
        List<String> cleaned = candidates.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(String::trim)
            .toList();
        return cleaned.isEmpty() ? DEFAULT_USER_AGENTS : cleaned;
    }

    public static class Imdb {
        private String baseUrl = "https://www.imdb.com";
        private int yearTolerance = 1;
        private int candidateYearTolerance = 2;

        public String getBaseUrl() {
            return stripTrailingSlash(baseUrl);
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getYearTolerance() {
            return Math.max(0, yearTolerance);
        }

        public void setYearTolerance(int yearTolerance) {
            this.yearTolerance = Math.max(0, yearTolerance);
        }

        public int getCandidateYearTolerance() {
            return Math.max(0, candidateYearTolerance);
        }

        public void setCandidateYearTolerance(int candidateYearTolerance) {
            this.candidateYearTolerance = Math.max(0, candidateYearTolerance);
        }
    }

    public static class Tmdb {
        private String imageBaseUrl = "https://image.tmdb.org/t/p/original";

        public String getImageBaseUrl() {
            return stripTrailingSlash(imageBaseUrl);
        }

        public void setImageBaseUrl(String imageBaseUrl) {
            this.imageBaseUrl = imageBaseUrl;
        }
    }

    public static class Cli {
        private boolean run;
        private String seedFile = "";
        private String sourceHtmlFile = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSeedFile() {
            return seedFile;
        }

        public void setSeedFile(String seedFile) {
            this.seedFile = seedFile;
        }

        public String getSourceHtmlFile() {
            return sourceHtmlFile;
        }

        public void setSourceHtmlFile(String sourceHtmlFile) {
            this.sourceHtmlFile = sourceHtmlFile;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
