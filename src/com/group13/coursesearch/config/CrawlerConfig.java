package com.group13.coursesearch.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Immutable crawl settings.
 * Defaults come from the bundled {@code crawler.properties}; the builder overrides single values.
 */
public class CrawlerConfig {

    private final List<String> seeds;
    private final String domain;
    private final int maxPages;
    private final Pattern coursePattern;
    private final List<String> excludedPaths;
    private final String titleSelector;
    private final String descriptionSelector;
    private final int minTitleLength;
    private final int minWords;
    private final int timeoutMs;
    private final String userAgent;

    private CrawlerConfig(Builder builder) {
        this.seeds = Collections.unmodifiableList(new ArrayList<>(builder.seeds));
        this.domain = builder.domain;
        this.maxPages = builder.maxPages;
        this.coursePattern = builder.coursePattern;
        this.excludedPaths = Collections.unmodifiableList(new ArrayList<>(builder.excludedPaths));
        this.titleSelector = builder.titleSelector;
        this.descriptionSelector = builder.descriptionSelector;
        this.minTitleLength = builder.minTitleLength;
        this.minWords = builder.minWords;
        this.timeoutMs = builder.timeoutMs;
        this.userAgent = builder.userAgent;
    }

    public static CrawlerConfig defaults() {
        return builder().build();
    }

    // Builder pre-filled with the bundled defaults.
    public static Builder builder() {
        return new Builder().apply(ResourceLoader.properties(ResourceLoader.CRAWLER_PROPERTIES));
    }

    public List<String> getSeeds() { return seeds; }
    public String getDomain() { return domain; }
    public int getMaxPages() { return maxPages; }
    public Pattern getCoursePattern() { return coursePattern; }
    public List<String> getExcludedPaths() { return excludedPaths; }
    public String getTitleSelector() { return titleSelector; }
    public String getDescriptionSelector() { return descriptionSelector; }
    public int getMinTitleLength() { return minTitleLength; }
    public int getMinWords() { return minWords; }
    public int getTimeoutMs() { return timeoutMs; }
    public String getUserAgent() { return userAgent; }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.seeds = new ArrayList<>(seeds);
        builder.domain = domain;
        builder.maxPages = maxPages;
        builder.coursePattern = coursePattern;
        builder.excludedPaths = new ArrayList<>(excludedPaths);
        builder.titleSelector = titleSelector;
        builder.descriptionSelector = descriptionSelector;
        builder.minTitleLength = minTitleLength;
        builder.minWords = minWords;
        builder.timeoutMs = timeoutMs;
        builder.userAgent = userAgent;
        return builder;
    }

    public static class Builder {
        private List<String> seeds = new ArrayList<>();
        private String domain = "";
        private int maxPages = 10;
        private Pattern coursePattern = Pattern.compile(".*");
        private List<String> excludedPaths = new ArrayList<>();
        private String titleSelector = "h1";
        private String descriptionSelector = "p";
        private int minTitleLength = 10;
        private int minWords = 3;
        private int timeoutMs = 10_000;
        private String userAgent = "course-search-crawler";

        private Builder() {
        }

        Builder apply(Properties properties) {
            String value = properties.getProperty("crawler.seeds");
            if (value != null) seeds = splitList(value);
            domain = properties.getProperty("crawler.domain", domain).trim();
            maxPages = intProperty(properties, "crawler.maxPages", maxPages);
            value = properties.getProperty("crawler.coursePattern");
            if (value != null) coursePattern(value.trim());
            value = properties.getProperty("crawler.excludedPaths");
            if (value != null) excludedPaths = splitList(value);
            titleSelector = properties.getProperty("crawler.titleSelector", titleSelector).trim();
            descriptionSelector = properties.getProperty("crawler.descriptionSelector", descriptionSelector).trim();
            minTitleLength = intProperty(properties, "crawler.minTitleLength", minTitleLength);
            minWords = intProperty(properties, "crawler.minWords", minWords);
            timeoutMs = intProperty(properties, "crawler.timeoutMs", timeoutMs);
            userAgent = properties.getProperty("crawler.userAgent", userAgent).trim();
            return this;
        }

        public Builder seeds(String... urls) {
            this.seeds = new ArrayList<>(Arrays.asList(urls));
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder maxPages(int maxPages) {
            this.maxPages = maxPages;
            return this;
        }

        public Builder coursePattern(String regex) {
            try {
                this.coursePattern = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid course pattern: " + regex, e);
            }
            return this;
        }

        public Builder excludedPaths(String... paths) {
            this.excludedPaths = new ArrayList<>(Arrays.asList(paths));
            return this;
        }

        public Builder titleSelector(String selector) {
            this.titleSelector = selector;
            return this;
        }

        public Builder descriptionSelector(String selector) {
            this.descriptionSelector = selector;
            return this;
        }

        public Builder minTitleLength(int minTitleLength) {
            this.minTitleLength = minTitleLength;
            return this;
        }

        public Builder minWords(int minWords) {
            this.minWords = minWords;
            return this;
        }

        public Builder timeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public CrawlerConfig build() {
            if (seeds.isEmpty()) {
                throw new IllegalArgumentException("At least one seed URL is required");
            }
            if (maxPages < 0) {
                throw new IllegalArgumentException("maxPages must not be negative: " + maxPages);
            }
            if (minWords < 1) {
                throw new IllegalArgumentException("minWords must be at least 1: " + minWords);
            }
            return new CrawlerConfig(this);
        }

        private static List<String> splitList(String value) {
            return Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toList());
        }

        private static int intProperty(Properties properties, String key, int fallback) {
            String value = properties.getProperty(key);
            if (value == null) return fallback;
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
            }
        }
    }
}
