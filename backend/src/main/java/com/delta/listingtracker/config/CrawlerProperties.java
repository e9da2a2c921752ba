package com.delta.listingtracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "delta-listing-tracker/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 1000;
    private int globalConcurrency = 3;
    private int requestTimeoutSeconds = 30;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private Pagination pagination = new Pagination();
    private Resolver resolver = new Resolver();
    private Coverage coverage = new Coverage();
    private Browser browser = new Browser();
    private Retention retention = new Retention();
    private Cli cli = new Cli();
    private Map<String, Platform> platforms = new LinkedHashMap<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public Resolver getResolver() {
        return resolver;
    }

    public void setResolver(Resolver resolver) {
        this.resolver = resolver;
    }

    public Coverage getCoverage() {
        return coverage;
    }

    public void setCoverage(Coverage coverage) {
        this.coverage = coverage;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Map<String, Platform> getPlatforms() {
        return platforms;
    }

    public void setPlatforms(Map<String, Platform> platforms) {
        this.platforms = platforms == null ? new LinkedHashMap<>() : platforms;
    }

    /**
     * Settings for one platform; an unconfigured platform gets a disabled default.
     */
    public Platform platform(String name) {
        if (name == null) {
            return new Platform();
        }
        Platform configured = platforms.get(name.toLowerCase(Locale.ROOT));
        return configured == null ? new Platform() : configured;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Pagination {
        private int maxPages = 0;
        private int hardPageCap = 500;
        private int pageRetries = 1;
        private int consecutiveFailureLimit = 2;
        private int pageDelayMinMs = 5000;
        private int pageDelayMaxMs = 8000;

        public int getMaxPages() {
            return Math.max(0, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(0, maxPages);
        }

        public int getHardPageCap() {
            return Math.max(1, hardPageCap);
        }

        public void setHardPageCap(int hardPageCap) {
            this.hardPageCap = Math.max(1, hardPageCap);
        }

        public int getPageRetries() {
            return Math.max(0, pageRetries);
        }

        public void setPageRetries(int pageRetries) {
            this.pageRetries = Math.max(0, pageRetries);
        }

        public int getConsecutiveFailureLimit() {
            return Math.max(1, consecutiveFailureLimit);
        }

        public void setConsecutiveFailureLimit(int consecutiveFailureLimit) {
            this.consecutiveFailureLimit = Math.max(1, consecutiveFailureLimit);
        }

        public int getPageDelayMinMs() {
            return Math.max(0, pageDelayMinMs);
        }

        public void setPageDelayMinMs(int pageDelayMinMs) {
            this.pageDelayMinMs = Math.max(0, pageDelayMinMs);
        }

        public int getPageDelayMaxMs() {
            return Math.max(getPageDelayMinMs(), pageDelayMaxMs);
        }

        public void setPageDelayMaxMs(int pageDelayMaxMs) {
            this.pageDelayMaxMs = Math.max(0, pageDelayMaxMs);
        }
    }

    public static class Resolver {
        private boolean enabled = true;
        private String baseUrl = "http://localhost:8191/v1";
        private int timeoutSeconds = 60;
        private int maxConcurrent = 1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getMaxConcurrent() {
            return Math.max(1, maxConcurrent);
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = Math.max(1, maxConcurrent);
        }
    }

    public static class Coverage {
        private int minItemsFloor = 100;
        private double minPageCoverage = 0.10;
        private double maxCountChangePercent = 10.0;
        private int itemTolerance = 120;

        public int getMinItemsFloor() {
            return Math.max(0, minItemsFloor);
        }

        public void setMinItemsFloor(int minItemsFloor) {
            this.minItemsFloor = Math.max(0, minItemsFloor);
        }

        public double getMinPageCoverage() {
            return Math.min(1.0, Math.max(0.0, minPageCoverage));
        }

        public void setMinPageCoverage(double minPageCoverage) {
            this.minPageCoverage = minPageCoverage;
        }

        public double getMaxCountChangePercent() {
            return Math.max(0.0, maxCountChangePercent);
        }

        public void setMaxCountChangePercent(double maxCountChangePercent) {
            this.maxCountChangePercent = maxCountChangePercent;
        }

        public int getItemTolerance() {
            return Math.max(0, itemTolerance);
        }

        public void setItemTolerance(int itemTolerance) {
            this.itemTolerance = Math.max(0, itemTolerance);
        }
    }

    public static class Browser {
        private String engine = "playwright";
        private boolean headless = false;
        private int navigationTimeoutMs = 30000;
        private String locale = "es-ES";
        private int maxScrollPasses = 10;
        private int scrollPauseMs = 800;

        public String getEngine() {
            return engine == null || engine.isBlank() ? "playwright" : engine.trim().toLowerCase(Locale.ROOT);
        }

        public void setEngine(String engine) {
            this.engine = engine;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getNavigationTimeoutMs() {
            return Math.max(1000, navigationTimeoutMs);
        }

        public void setNavigationTimeoutMs(int navigationTimeoutMs) {
            this.navigationTimeoutMs = navigationTimeoutMs;
        }

        public String getLocale() {
            return locale;
        }

        public void setLocale(String locale) {
            this.locale = locale;
        }

        /**
         * Upper bound on scroll-to-bottom passes after each navigation or click; 0 disables scrolling.
         */
        public int getMaxScrollPasses() {
            return Math.max(0, Math.min(50, maxScrollPasses));
        }

        public void setMaxScrollPasses(int maxScrollPasses) {
            this.maxScrollPasses = maxScrollPasses;
        }

        public int getScrollPauseMs() {
            return Math.max(0, scrollPauseMs);
        }

        public void setScrollPauseMs(int scrollPauseMs) {
            this.scrollPauseMs = scrollPauseMs;
        }
    }

    public static class Retention {
        private int inventoryDays = 30;

        public int getInventoryDays() {
            return Math.max(0, inventoryDays);
        }

        public void setInventoryDays(int inventoryDays) {
            this.inventoryDays = Math.max(0, inventoryDays);
        }
    }

    public static class Cli {
        private boolean run;
        private String platforms = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getPlatforms() {
            return platforms;
        }

        public void setPlatforms(String platforms) {
            this.platforms = platforms;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Platform {
        private boolean enabled;
        private String baseUrl;
        private List<String> targets = new ArrayList<>();
        private Integer maxPages;
        private List<String> excludedCountries = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public List<String> getTargets() {
            return targets;
        }

        public void setTargets(List<String> targets) {
            this.targets = targets == null ? new ArrayList<>() : targets;
        }

        public Integer getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(Integer maxPages) {
            this.maxPages = maxPages;
        }

        public List<String> getExcludedCountries() {
            return excludedCountries;
        }

        public void setExcludedCountries(List<String> excludedCountries) {
            this.excludedCountries = excludedCountries == null ? new ArrayList<>() : excludedCountries;
        }
    }
}
