package com.abroadhelper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@ConfigurationProperties(prefix = "resources")
public class ResourceProperties {
    private static final String DEFAULT_USER_AGENT = "NepaliAbroadHelper/1.0 (Educational Project; contact@example.com)";
    private static final String DEFAULT_PROBE_USER_AGENT = "NepaliAbroadHelper/DataValidator";

    private String userAgent;
    private Duration requestDelay = Duration.ofSeconds(2);
    private int requestTimeoutSeconds = 30;
    private int maxRetries = 3;
    private int retryBaseDelayMs = 1000;
    private Validation validation = new Validation();
    private LinkCheck linkCheck = new LinkCheck();
    private Robots robots = new Robots();
    private Cli cli = new Cli();
    private List<Source> sources = new ArrayList<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent, DEFAULT_USER_AGENT);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent, DEFAULT_USER_AGENT);
    }

    public Duration getRequestDelay() {
        return requestDelay;
    }

    public void setRequestDelay(Duration requestDelay) {
        this.requestDelay = requestDelay == null || requestDelay.isNegative() ? Duration.ZERO : requestDelay;
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getMaxRetries() {
        return Math.max(0, maxRetries);
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
    }

    public int getRetryBaseDelayMs() {
        return Math.max(0, retryBaseDelayMs);
    }

    public void setRetryBaseDelayMs(int retryBaseDelayMs) {
        this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public LinkCheck getLinkCheck() {
        return linkCheck;
    }

    public void setLinkCheck(LinkCheck linkCheck) {
        this.linkCheck = linkCheck;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public List<Source> getSources() {
        return sources;
    }

    public void setSources(List<Source> sources) {
        this.sources = sources == null ? new ArrayList<>() : sources;
    }

    public static String normalizeUserAgent(String candidate, String fallback) {
        if (candidate == null || candidate.isBlank()) {
            return fallback;
        }
        return candidate.trim();
    }

    public static class Validation {
        private int staleThresholdDays = 90;
        private Set<Integer> brokenStatusCodes = new LinkedHashSet<>(List.of(404, 403, 410, 500, 502, 503));

        public int getStaleThresholdDays() {
            return Math.max(0, staleThresholdDays);
        }

        public void setStaleThresholdDays(int staleThresholdDays) {
            this.staleThresholdDays = Math.max(0, staleThresholdDays);
        }

        public Set<Integer> getBrokenStatusCodes() {
            return brokenStatusCodes;
        }

        public void setBrokenStatusCodes(Set<Integer> brokenStatusCodes) {
            this.brokenStatusCodes = brokenStatusCodes == null ? new LinkedHashSet<>() : new LinkedHashSet<>(brokenStatusCodes);
        }
    }

    public static class LinkCheck {
        private int concurrency = 10;
        private String userAgent;
        private Duration deadline;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent, DEFAULT_PROBE_USER_AGENT);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent, DEFAULT_PROBE_USER_AGENT);
        }

        /** Overall link-check budget for one run; {@code null} waits for every probe. */
        public Duration getDeadline() {
            return deadline;
        }

        public void setDeadline(Duration deadline) {
            this.deadline = deadline == null || deadline.isZero() || deadline.isNegative() ? null : deadline;
        }
    }

    public static class Robots {
        private Duration cacheTtl = Duration.ofHours(6);
        private int maxCachedPolicies = 2048;

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl == null || cacheTtl.isNegative() ? Duration.ZERO : cacheTtl;
        }

        public int getMaxCachedPolicies() {
            return Math.max(1, maxCachedPolicies);
        }

        public void setMaxCachedPolicies(int maxCachedPolicies) {
            this.maxCachedPolicies = Math.max(1, maxCachedPolicies);
        }
    }

    public static class Cli {
        private boolean run;
        private String category = "";
        private String output = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category == null ? "" : category.trim();
        }

        public String getOutput() {
            return output;
        }

        public void setOutput(String output) {
            this.output = output == null ? "" : output.trim();
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    /**
     * One page that the scraper is allowed to visit. Selectors are optional; a source without an
     * item selector yields no records.
     */
    public static class Source {
        private String name;
        private String url;
        private String robotsUrl;
        private String category = "scholarship";
        private String country = "Canada";
        private String institution;
        private List<String> tags = new ArrayList<>();
        private Selectors selectors = new Selectors();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getRobotsUrl() {
            return robotsUrl;
        }

        public void setRobotsUrl(String robotsUrl) {
            this.robotsUrl = robotsUrl;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public String getCountry() {
            return country;
        }

        public void setCountry(String country) {
            this.country = country;
        }

        public String getInstitution() {
            return institution;
        }

        public void setInstitution(String institution) {
            this.institution = institution;
        }

        public List<String> getTags() {
            return tags;
        }

        public void setTags(List<String> tags) {
            this.tags = tags == null ? new ArrayList<>() : tags;
        }

        public Selectors getSelectors() {
            return selectors;
        }

        public void setSelectors(Selectors selectors) {
            this.selectors = selectors == null ? new Selectors() : selectors;
        }
    }

    public static class Selectors {
        private String item;
        private String title;
        private String link;
        private String description;
        private String institution;
        private String deadline;

        public String getItem() {
            return item;
        }

        public void setItem(String item) {
            this.item = item;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getLink() {
            return link;
        }

        public void setLink(String link) {
            this.link = link;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getInstitution() {
            return institution;
        }

        public void setInstitution(String institution) {
            this.institution = institution;
        }

        public String getDeadline() {
            return deadline;
        }

        public void setDeadline(String deadline) {
            this.deadline = deadline;
        }
    }
}
