package com.cinemaregistry.config;

import com.cinemaregistry.scrape.rate.PacingMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private Endpoint endpoint = new Endpoint();
    private Rate rate = new Rate();
    private Retry retry = new Retry();
    private Run run = new Run();
    private Output output = new Output();
    private Cli cli = new Cli();

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    public Rate getRate() {
        return rate;
    }

    public void setRate(Rate rate) {
        this.rate = rate;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
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

    public static class Endpoint {
        private String url = "https://ys.endata.cn/enlib-api/api/cinema/getcinema_baseinfo_byid.do";
        private String identifierParam = "cinemaid";
        private String cacheBusterParam = "r";
        private long connectTimeoutMs = 3050;
        private long requestTimeoutMs = 30000;
        private String origin = "https://ys.endata.cn";
        private String referer = "https://ys.endata.cn/Details/Cinema";
        private String acceptLanguage = "zh-CN,zh;q=0.9";
        private List<String> userAgents = new ArrayList<>();

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getIdentifierParam() {
            return identifierParam;
        }

        public void setIdentifierParam(String identifierParam) {
            this.identifierParam = identifierParam;
        }

        public String getCacheBusterParam() {
            return cacheBusterParam;
        }

        public void setCacheBusterParam(String cacheBusterParam) {
            this.cacheBusterParam = cacheBusterParam;
        }

        public long getConnectTimeoutMs() {
            return Math.max(1, connectTimeoutMs);
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = Math.max(1, connectTimeoutMs);
        }

        public long getRequestTimeoutMs() {
            return Math.max(1, requestTimeoutMs);
        }

        public void setRequestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = Math.max(1, requestTimeoutMs);
        }

        public String getOrigin() {
            return origin;
        }

        public void setOrigin(String origin) {
            this.origin = origin;
        }

        public String getReferer() {
            return referer;
        }

        public void setReferer(String referer) {
            this.referer = referer;
        }

        public String getAcceptLanguage() {
            return acceptLanguage;
        }

        public void setAcceptLanguage(String acceptLanguage) {
            this.acceptLanguage = acceptLanguage;
        }

        public List<String> getUserAgents() {
            List<String> out = new ArrayList<>();
            if (userAgents != null) {
                for (String candidate : userAgents) {
                    if (candidate != null && !candidate.isBlank()) {
                        out.add(candidate.trim());
                    }
                }
            }
            if (out.isEmpty()) {
                out.add(DEFAULT_USER_AGENT);
            }
            return out;
        }

        public void setUserAgents(List<String> userAgents) {
            this.userAgents = userAgents;
        }
    }

    /**
     * Tuning for the adaptive rate controller. Intervals are in seconds.
     */
    public static class Rate {
        private double initialIntervalSeconds = 0.3;
        private double minIntervalSeconds = 0.05;
        private double maxIntervalSeconds = 5.0;
        private double speedUpFactor = 0.9;
        private double slowDownFactor = 1.5;
        private long fastSuccessWindowMs = 500;
        private int timeoutThreshold = 2;
        private double errorStormThreshold = 10;
        private double errorStormPauseSecondsPerError = 5;
        private double maxErrorStormPauseSeconds = 60;
        private PacingMode pacingMode = PacingMode.CONFIRMED;

        public double getInitialIntervalSeconds() {
            return initialIntervalSeconds;
        }

        public void setInitialIntervalSeconds(double initialIntervalSeconds) {
            this.initialIntervalSeconds = initialIntervalSeconds;
        }

        public double getMinIntervalSeconds() {
            return Math.max(0.0, minIntervalSeconds);
        }

        public void setMinIntervalSeconds(double minIntervalSeconds) {
            this.minIntervalSeconds = Math.max(0.0, minIntervalSeconds);
        }

        public double getMaxIntervalSeconds() {
            return Math.max(getMinIntervalSeconds(), maxIntervalSeconds);
        }

        public void setMaxIntervalSeconds(double maxIntervalSeconds) {
            this.maxIntervalSeconds = maxIntervalSeconds;
        }

        public double getSpeedUpFactor() {
            return speedUpFactor;
        }

        public void setSpeedUpFactor(double speedUpFactor) {
            this.speedUpFactor = speedUpFactor;
        }

        public double getSlowDownFactor() {
            return slowDownFactor;
        }

        public void setSlowDownFactor(double slowDownFactor) {
            this.slowDownFactor = slowDownFactor;
        }

        public long getFastSuccessWindowMs() {
            return Math.max(0, fastSuccessWindowMs);
        }

        public void setFastSuccessWindowMs(long fastSuccessWindowMs) {
            this.fastSuccessWindowMs = Math.max(0, fastSuccessWindowMs);
        }

        public int getTimeoutThreshold() {
            return Math.max(0, timeoutThreshold);
        }

        public void setTimeoutThreshold(int timeoutThreshold) {
            this.timeoutThreshold = Math.max(0, timeoutThreshold);
        }

        public double getErrorStormThreshold() {
            return Math.max(1, errorStormThreshold);
        }

        public void setErrorStormThreshold(double errorStormThreshold) {
            this.errorStormThreshold = Math.max(1, errorStormThreshold);
        }

        public double getErrorStormPauseSecondsPerError() {
            return Math.max(0, errorStormPauseSecondsPerError);
        }

        public void setErrorStormPauseSecondsPerError(double errorStormPauseSecondsPerError) {
            this.errorStormPauseSecondsPerError = Math.max(0, errorStormPauseSecondsPerError);
        }

        public double getMaxErrorStormPauseSeconds() {
            return Math.max(0, maxErrorStormPauseSeconds);
        }

        public void setMaxErrorStormPauseSeconds(double maxErrorStormPauseSeconds) {
            this.maxErrorStormPauseSeconds = Math.max(0, maxErrorStormPauseSeconds);
        }

        public PacingMode getPacingMode() {
            return pacingMode == null ? PacingMode.CONFIRMED : pacingMode;
        }

        public void setPacingMode(PacingMode pacingMode) {
            this.pacingMode = pacingMode;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }
    }

    public static class Run {
        private static final Duration DEFAULT_CHECKPOINT_INTERVAL = Duration.ofMinutes(60);
        private static final Duration MIN_CHECKPOINT_INTERVAL = Duration.ofMillis(100);

        private Duration checkpointInterval = DEFAULT_CHECKPOINT_INTERVAL;
        private int joinTimeoutSeconds = 10;
        private int progressLogEvery = 100;

        public Duration getCheckpointInterval() {
            if (checkpointInterval == null) {
                return DEFAULT_CHECKPOINT_INTERVAL;
            }
            return checkpointInterval.compareTo(MIN_CHECKPOINT_INTERVAL) < 0 ? MIN_CHECKPOINT_INTERVAL : checkpointInterval;
        }

        public void setCheckpointInterval(Duration checkpointInterval) {
            this.checkpointInterval = checkpointInterval;
        }

        public int getJoinTimeoutSeconds() {
            return Math.max(1, joinTimeoutSeconds);
        }

        public void setJoinTimeoutSeconds(int joinTimeoutSeconds) {
            this.joinTimeoutSeconds = Math.max(1, joinTimeoutSeconds);
        }

        public int getProgressLogEvery() {
            return Math.max(1, progressLogEvery);
        }

        public void setProgressLogEvery(int progressLogEvery) {
            this.progressLogEvery = Math.max(1, progressLogEvery);
        }
    }

    public static class Output {
        private String directory = "results";
        private String identifierField = "CinemaID";
        private String nameField = "CinemaName";
        private String codeField = "ZZID";

        public String getDirectory() {
            return directory == null || directory.isBlank() ? "results" : directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getIdentifierField() {
            return identifierField;
        }

        public void setIdentifierField(String identifierField) {
            this.identifierField = identifierField;
        }

        public String getNameField() {
            return nameField;
        }

        public void setNameField(String nameField) {
            this.nameField = nameField;
        }

        public String getCodeField() {
            return codeField;
        }

        public void setCodeField(String codeField) {
            this.codeField = codeField;
        }
    }

    public static class Cli {
        private boolean run;
        private long startId = 1;
        private long endId = 50000;
        private int workerCount = 5;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public long getStartId() {
            return startId;
        }

        public void setStartId(long startId) {
            this.startId = startId;
        }

        public long getEndId() {
            return endId;
        }

        public void setEndId(long endId) {
            this.endId = endId;
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
