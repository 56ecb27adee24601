package com.group13.coursesearch.pipeline;

import com.group13.coursesearch.config.CrawlerConfig;
import com.group13.coursesearch.core.FetchException;
import com.group13.coursesearch.core.Normalizer;
import com.group13.coursesearch.core.PageFetcher;
import com.group13.coursesearch.core.PageValidator;
import com.group13.coursesearch.impl.CoursePageParser;
import com.group13.coursesearch.impl.HttpPageFetcher;
import com.group13.coursesearch.impl.InvertedIndexBuilder;
import com.group13.coursesearch.impl.LayeredPageValidator;
import com.group13.coursesearch.impl.TextNormalizer;
import com.group13.coursesearch.model.CourseDictionary;
import com.group13.coursesearch.model.CoursePage;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.CrawlResult;
import com.group13.coursesearch.model.CrawlStats;
import com.group13.coursesearch.model.FetchedPage;
import com.group13.coursesearch.model.ValidationResult;
import com.group13.coursesearch.tracing.TraceBus;
import com.group13.coursesearch.utils.CourseIds;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Breadth-first crawler over the course catalog.
 * <p>
 * A FIFO frontier is seeded with the configured URLs. Each dequeued URL is visited at most
 * once; every successfully fetched page counts against the page budget, has its outbound
 * site links enqueued, and becomes a {@link CourseRecord} only if it passes all validation
 * layers. Fetch failures and rejections are traced and skipped. The run ends when the frontier
 * is empty or the page budget is spent; both are normal outcomes.
 * <p>
 * One instance runs one crawl at a time; the visited set and frontier are local to {@link #crawl()}.
 */
public class CourseCrawler {

    private final CrawlerConfig config;
    private final PageFetcher fetcher;
    private final CoursePageParser parser;
    private final PageValidator validator;

    public CourseCrawler(CrawlerConfig config) {
        this(config, new HttpPageFetcher(config), TextNormalizer.withDefaultStopWords());
    }

    public CourseCrawler(CrawlerConfig config, PageFetcher fetcher, Normalizer normalizer) {
        this(config, fetcher, new CoursePageParser(config), new LayeredPageValidator(config, normalizer));
    }

    // Constructor Injection of every collaborator
    public CourseCrawler(CrawlerConfig config, PageFetcher fetcher, CoursePageParser parser, PageValidator validator) {
        this.config = config;
        this.fetcher = fetcher;
        this.parser = parser;
        this.validator = validator;
    }

    public CrawlResult crawl() {
        CrawlStats stats = new CrawlStats();
        stats.markStart();

        // 1. Initialization
        Deque<String> frontier = new ArrayDeque<>();
        Set<String> queued = new HashSet<>();
        Set<String> visited = new HashSet<>();
        Map<String, CourseRecord> courses = new LinkedHashMap<>();
        for (String seed : config.getSeeds()) {
            String url = CourseIds.removeFragment(seed.trim());
            if (queued.add(url)) {
                frontier.addLast(url);
            }
        }
        TraceBus.push("CRAWL_START", "seeds=" + config.getSeeds() + ", maxPages=" + config.getMaxPages());

        // 2. Traversal
        while (stats.getPagesFetched() < config.getMaxPages() && !frontier.isEmpty()) {
            String url = frontier.pollFirst();
            if (!visited.add(url)) {
                continue;
            }

            stats.recordFetchAttempt();
            long fetchStart = System.currentTimeMillis();
            FetchedPage fetched;
            try {
                fetched = fetcher.fetch(url);
            } catch (FetchException e) {
                stats.recordFetchFailure();
                TraceBus.pushFull("FETCH_FAILED", url, "", System.currentTimeMillis() - fetchStart, e.getMessage());
                continue;
            }
            stats.recordPageFetched();
            TraceBus.pushFull("FETCH", url, "status=" + fetched.getStatusCode() + ", bytes=" + fetched.getBody().length(),
                    System.currentTimeMillis() - fetchStart, null);

            String pageUrl = CourseIds.removeFragment(fetched.getFinalUrl());
            visited.add(pageUrl);

            try {
                processPage(pageUrl, fetched.getBody(), frontier, queued, visited, courses, stats);
            } catch (RuntimeException e) {
                // A broken page must not end the run
                stats.recordProcessingFailure();
                TraceBus.error("REJECT", pageUrl, "processing failed: " + e);
            }
        }

        // 3. Termination
        CrawlResult.Termination termination = frontier.isEmpty() && stats.getPagesFetched() < config.getMaxPages()
                ? CrawlResult.Termination.FRONTIER_EXHAUSTED
                : CrawlResult.Termination.PAGE_BUDGET_REACHED;
        stats.markEnd();

        CourseDictionary dictionary = new CourseDictionary(courses);
        CrawlResult result = new CrawlResult(dictionary, InvertedIndexBuilder.rows(dictionary), stats, termination);
        TraceBus.pushFull("CRAWL_END", termination.name(), stats.toString(), stats.getElapsedMillis(), null);
        return result;
    }

    private void processPage(String pageUrl, String html, Deque<String> frontier, Set<String> queued,
                             Set<String> visited, Map<String, CourseRecord> courses, CrawlStats stats) {
        CoursePage page = parser.parse(pageUrl, html);

        ValidationResult validation = validator.validate(page);
        if (validation.isAccepted()) {
            String courseId = CourseIds.slugFromUrl(pageUrl);
            if (courses.containsKey(courseId)) {
                stats.recordDuplicateCourse();
                TraceBus.error("REJECT", pageUrl, "duplicate course id " + courseId);
            } else {
                CourseRecord record = new CourseRecord(courseId, pageUrl, page.getTitle(),
                        page.getDescription(), validation.getWords());
                courses.put(courseId, record);
                stats.recordCourseAccepted();
                TraceBus.push("ACCEPT", courseId + " (" + record.getWords().size() + " words)");
            }
        } else {
            stats.recordRejection(validation.getFailedLayer());
            TraceBus.error("REJECT", pageUrl, validation.getFailedLayer() + ": " + validation.getReason());
        }

        // Listing pages are rejected as courses but still lead to them
        int enqueued = 0;
        for (String link : page.getLinks()) {
            if (isFollowable(link) && !visited.contains(link) && queued.add(link)) {
                frontier.addLast(link);
                enqueued++;
            }
        }
        stats.recordLinksEnqueued(enqueued);
    }

    /*
      A link is followed when it is an absolute http(s) URL on the configured domain,
      is not an e-mail link, and points to an extension-less path or an .html/.htm page.
     */
    boolean isFollowable(String url) {
        if (url.contains("@") || url.toLowerCase(Locale.ROOT).startsWith("mailto:")) {
            return false;
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            return false;
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            return false;
        }
        String host = uri.getHost();
        String domain = config.getDomain();
        if (host == null) {
            return false;
        }
        if (!domain.isEmpty()) {
            String h = host.toLowerCase(Locale.ROOT);
            String d = domain.toLowerCase(Locale.ROOT);
            if (!h.equals(d) && !h.endsWith("." + d)) {
                return false;
            }
        }

        String path = uri.getPath() != null ? uri.getPath().toLowerCase(Locale.ROOT) : "";
        if (path.isEmpty() || path.endsWith("/")) {
            return true;
        }
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        return !lastSegment.contains(".") || lastSegment.endsWith(".html") || lastSegment.endsWith(".htm");
    }
}
