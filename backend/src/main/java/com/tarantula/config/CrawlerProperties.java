package com.tarantula.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "tarantula/0.1";

    private String userAgent;
    private int perHostDelayMs = 1000;
    private int perHostConcurrency = 2;
    private int workerCount = Math.max(2, Runtime.getRuntime().availableProcessors());
    private int requestTimeoutSeconds = 20;
    private int connectTimeoutSeconds = 10;
    private int maxBodyBytes = 5 * 1024 * 1024;
    private int idlePollMs = 250;
    private Defaults defaults = new Defaults();
    private Robots robots = new Robots();
    private Callback callback = new Callback();
    private Runs runs = new Runs();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(0, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(0, perHostDelayMs);
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
    }

    public int getWorkerCount() {
        return Math.max(1, workerCount);
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = Math.max(1, workerCount);
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

    public int getMaxBodyBytes() {
        return Math.max(1, maxBodyBytes);
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = Math.max(1, maxBodyBytes);
    }

    public int getIdlePollMs() {
        return Math.max(10, idlePollMs);
    }

    public void setIdlePollMs(int idlePollMs) {
        this.idlePollMs = Math.max(10, idlePollMs);
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public Callback getCallback() {
        return callback;
    }

    public void setCallback(Callback callback) {
        this.callback = callback;
    }

    public Runs getRuns() {
        return runs;
    }

    public void setRuns(Runs runs) {
        this.runs = runs;
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

    /**
     * Values applied to a run submission that leaves the field out.
     */
    public static class Defaults {
        private boolean ignoreRedirects = false;
        private int maximumRedirects = 10;
        private int maximumDepth = 16;
        private boolean ignoreRobotsTxt = false;
        private boolean keepHtmlInMemory = false;

        public boolean isIgnoreRedirects() {
            return ignoreRedirects;
        }

        public void setIgnoreRedirects(boolean ignoreRedirects) {
            this.ignoreRedirects = ignoreRedirects;
        }

        public int getMaximumRedirects() {
            return Math.max(0, maximumRedirects);
        }

        public void setMaximumRedirects(int maximumRedirects) {
            this.maximumRedirects = Math.max(0, maximumRedirects);
        }

        public int getMaximumDepth() {
            return Math.max(0, maximumDepth);
        }

        public void setMaximumDepth(int maximumDepth) {
            this.maximumDepth = Math.max(0, maximumDepth);
        }

        public boolean isIgnoreRobotsTxt() {
            return ignoreRobotsTxt;
        }

        public void setIgnoreRobotsTxt(boolean ignoreRobotsTxt) {
            this.ignoreRobotsTxt = ignoreRobotsTxt;
        }

        public boolean isKeepHtmlInMemory() {
            return keepHtmlInMemory;
        }

        public void setKeepHtmlInMemory(boolean keepHtmlInMemory) {
            this.keepHtmlInMemory = keepHtmlInMemory;
        }
    }

    public static class Robots {
        private int maxRedirects = 5;
        private int maxBodyBytes = 512 * 1024;

        public int getMaxRedirects() {
            return Math.max(0, maxRedirects);
        }

        public void setMaxRedirects(int maxRedirects) {
            this.maxRedirects = Math.max(0, maxRedirects);
        }

        public int getMaxBodyBytes() {
            return Math.max(1, maxBodyBytes);
        }

        public void setMaxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = Math.max(1, maxBodyBytes);
        }
    }

    public static class Callback {
        private int queueCapacity = 1000;
        private int deliveryThreads = 2;
        private int maxAttempts = 3;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 5000;
        private int requestTimeoutSeconds = 10;

        public int getQueueCapacity() {
            return Math.max(1, queueCapacity);
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = Math.max(1, queueCapacity);
        }

        public int getDeliveryThreads() {
            return Math.max(1, deliveryThreads);
        }

        public void setDeliveryThreads(int deliveryThreads) {
            this.deliveryThreads = Math.max(1, deliveryThreads);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Runs {
        private int historySize = 100;

        public int getHistorySize() {
            return Math.max(1, historySize);
        }

        public void setHistorySize(int historySize) {
            this.historySize = Math.max(1, historySize);
        }
    }

    public static class Cli {
        private boolean run;
        private String url = "";
        private Integer maximumDepth;
        private String callbackUrl;
        private long timeoutMinutes = 60;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Integer getMaximumDepth() {
            return maximumDepth;
        }

        public void setMaximumDepth(Integer maximumDepth) {
            this.maximumDepth = maximumDepth;
        }

        public String getCallbackUrl() {
            return callbackUrl;
        }

        public void setCallbackUrl(String callbackUrl) {
            this.callbackUrl = callbackUrl;
        }

        public long getTimeoutMinutes() {
            return Math.max(1, timeoutMinutes);
        }

        public void setTimeoutMinutes(long timeoutMinutes) {
            this.timeoutMinutes = Math.max(1, timeoutMinutes);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
