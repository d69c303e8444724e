package io.cronwarden.config;

import io.cronwarden.core.ScheduleKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runtime configuration for the cronwarden scheduler and the jobs it can build from configuration.
 */
@ConfigurationProperties(prefix = "cronwarden")
public class CronwardenProperties {
    private boolean enabled = true;
    private boolean autoStartup = true;
    private String zone = "UTC"; // cron evaluation zone
    private Duration defaultJobTimeout = Duration.ofMinutes(5);
    private int defaultAlertThreshold = 3;
    private Duration storeTimeout = Duration.ofSeconds(5);
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);
    private Duration misfireGrace = Duration.ofMinutes(5); // how far back a late tick catches up
    private boolean ensureIndexesOnStartup = false;

    private final MarketSession marketSession = new MarketSession();
    private final Digest digest = new Digest();
    private final Quality quality = new Quality();
    private List<Job> jobs = new ArrayList<>();
    private List<ThresholdTrigger> thresholdTriggers = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Duration getDefaultJobTimeout() {
        return defaultJobTimeout;
    }

    public void setDefaultJobTimeout(Duration defaultJobTimeout) {
        this.defaultJobTimeout = defaultJobTimeout;
    }

    public int getDefaultAlertThreshold() {
        return defaultAlertThreshold;
    }

    public void setDefaultAlertThreshold(int defaultAlertThreshold) {
        this.defaultAlertThreshold = defaultAlertThreshold;
    }

    public Duration getStoreTimeout() {
        return storeTimeout;
    }

    public void setStoreTimeout(Duration storeTimeout) {
        this.storeTimeout = storeTimeout;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public Duration getMisfireGrace() {
        return misfireGrace;
    }

    public void setMisfireGrace(Duration misfireGrace) {
        this.misfireGrace = misfireGrace;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public MarketSession getMarketSession() {
        return marketSession;
    }

    public Digest getDigest() {
        return digest;
    }

    public Quality getQuality() {
        return quality;
    }

    public List<Job> getJobs() {
        return jobs;
    }

    public void setJobs(List<Job> jobs) {
        this.jobs = jobs;
    }

    public List<ThresholdTrigger> getThresholdTriggers() {
        return thresholdTriggers;
    }

    public void setThresholdTriggers(List<ThresholdTrigger> thresholdTriggers) {
        this.thresholdTriggers = thresholdTriggers;
    }

    /**
     * Trading session used by jobs flagged {@code market-hours-only}. Defaults to the US equities session.
     */
    public static class MarketSession {
        private String zone = "America/New_York";
        private LocalTime open = LocalTime.of(9, 30);
        private LocalTime close = LocalTime.of(16, 0);
        private Set<DayOfWeek> days = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public LocalTime getOpen() {
            return open;
        }

        public void setOpen(LocalTime open) {
            this.open = open;
        }

        public LocalTime getClose() {
            return close;
        }

        public void setClose(LocalTime close) {
            this.close = close;
        }

        public Set<DayOfWeek> getDays() {
            return days;
        }

        public void setDays(Set<DayOfWeek> days) {
            this.days = days;
        }
    }

    public static class Digest {
        private boolean enabled = true;
        private String schedule = "0 8 * * *";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }
    }

    /**
     * A job that calls an external service on a schedule.
     */
    public static class Job {
        private String id;
        private String name;
        private String schedule;
        private ScheduleKind scheduleKind = ScheduleKind.CRON;
        private boolean marketHoursOnly = false;
        private boolean enabled = true;
        private URI target;
        private String method = "POST";
        private Map<String, Object> params = new LinkedHashMap<>();
        private Map<String, String> headers = new LinkedHashMap<>();
        private List<String> requiredFields = new ArrayList<>();
        private Duration timeout;
        private int alertThreshold = 0; // 0 = use default-alert-threshold

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public ScheduleKind getScheduleKind() {
            return scheduleKind;
        }

        public void setScheduleKind(ScheduleKind scheduleKind) {
            this.scheduleKind = scheduleKind;
        }

        public boolean isMarketHoursOnly() {
            return marketHoursOnly;
        }

        public void setMarketHoursOnly(boolean marketHoursOnly) {
            this.marketHoursOnly = marketHoursOnly;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public URI getTarget() {
            return target;
        }

        public void setTarget(URI target) {
            this.target = target;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public Map<String, Object> getParams() {
            return params;
        }

        public void setParams(Map<String, Object> params) {
            this.params = params;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }

        public List<String> getRequiredFields() {
            return requiredFields;
        }

        public void setRequiredFields(List<String> requiredFields) {
            this.requiredFields = requiredFields;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getAlertThreshold() {
            return alertThreshold;
        }

        public void setAlertThreshold(int alertThreshold) {
            this.alertThreshold = alertThreshold;
        }
    }

    public static class Quality {
        private boolean jobHealthCheck = true;
        private Duration staleAfter = Duration.ofHours(25);
        private final Tiers tiers = new Tiers();

        /**
         * Whether the fast tier also reports failing and stale scheduled jobs.
         */
        public boolean isJobHealthCheck() {
            return jobHealthCheck;
        }

        public void setJobHealthCheck(boolean jobHealthCheck) {
            this.jobHealthCheck = jobHealthCheck;
        }

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }

        public Tiers getTiers() {
            return tiers;
        }
    }

    public static class Tiers {
        private final TierConfig fast = new TierConfig();
        private final TierConfig deep = new TierConfig();
        private final TierConfig audit = new TierConfig();

        public TierConfig getFast() {
            return fast;
        }

        public TierConfig getDeep() {
            return deep;
        }

        public TierConfig getAudit() {
            return audit;
        }
    }

    /**
     * One quality tier. Blank {@code id}, {@code name} and {@code schedule} fall back to the tier defaults.
     */
    public static class TierConfig {
        private boolean enabled = false;
        private String id;
        private String name;
        private String schedule;
        private Duration timeout;
        private List<Check> checks = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public List<Check> getChecks() {
            return checks;
        }

        public void setChecks(List<Check> checks) {
            this.checks = checks;
        }
    }

    /**
     * A quality check served by an HTTP endpoint that answers with a list of issues.
     */
    public static class Check {
        private String id;
        private URI target;
        private String method = "GET";
        private Map<String, String> headers = new LinkedHashMap<>();
        private Duration timeout;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public URI getTarget() {
            return target;
        }

        public void setTarget(URI target) {
            this.target = target;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class ThresholdTrigger {
        private String id;
        private String name;
        private String schedule = "*/5 * * * *";
        private long threshold;
        private URI target;
        private Map<String, Object> params = new LinkedHashMap<>();
        private Map<String, String> headers = new LinkedHashMap<>();
        private Duration timeout;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public long getThreshold() {
            return threshold;
        }

        public void setThreshold(long threshold) {
            this.threshold = threshold;
        }

        public URI getTarget() {
            return target;
        }

        public void setTarget(URI target) {
            this.target = target;
        }

        public Map<String, Object> getParams() {
            return params;
        }

        public void setParams(Map<String, Object> params) {
            this.params = params;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
