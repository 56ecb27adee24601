package com.group13.coursesearch.app;

import com.group13.coursesearch.config.CrawlerConfig;
import com.group13.coursesearch.config.ResourceLoader;
import com.group13.coursesearch.impl.RuntimeMemoryProbe;
import com.group13.coursesearch.impl.TextNormalizer;
import com.group13.coursesearch.model.CourseDictionary;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.CrawlResult;
import com.group13.coursesearch.model.InvertedIndex;
import com.group13.coursesearch.model.PerformanceMetrics;
import com.group13.coursesearch.model.ScoreResult;
import com.group13.coursesearch.model.SearchMethod;
import com.group13.coursesearch.model.SearchPerformance;
import com.group13.coursesearch.model.SearchStatistics;
import com.group13.coursesearch.model.SimilarityMethod;
import com.group13.coursesearch.model.UnknownCourseException;
import com.group13.coursesearch.pipeline.CourseComparator;
import com.group13.coursesearch.pipeline.CourseCrawler;
import com.group13.coursesearch.pipeline.CourseSearchEngine;
import com.group13.coursesearch.tracing.JsonlTraceSink;
import com.group13.coursesearch.tracing.TraceBus;
import com.group13.coursesearch.utils.CourseStore;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Map;

public class Main {

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  crawl <pages> [dict_file] [index_file]",
            "  search \"<query>\" [dict_file] [index_file] [max_results] [relevance|cosine|tfidf|smart]",
            "  compare <id1> <id2> [dict_file] [index_file] [--metrics|--compare-all]");

    public static void main(String[] args) {
        // --- 1. ARGUMENT CHECK ---
        if (args.length == 0) {
            System.err.println("ERROR: Command not specified!");
            System.err.println(USAGE);
            System.exit(2);
            return;
        }

        // --- 2. LOGGING (Write to file, keep stdout for results) ---
        registerTraceSinks();

        // --- 3. DISPATCH ---
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        int status;
        try {
            switch (args[0]) {
                case "crawl":
                    status = crawl(rest);
                    break;
                case "search":
                    status = search(rest);
                    break;
                case "compare":
                    status = compare(rest);
                    break;
                default:
                    System.err.println("ERROR: Unknown command '" + args[0] + "'");
                    System.err.println(USAGE);
                    status = 2;
            }
        } catch (IOException e) {
            System.err.println("CRITICAL ERROR: " + e.getMessage());
            status = 1;
        } catch (UnknownCourseException | IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            status = 1;
        }
        System.exit(status);
    }

    private static void registerTraceSinks() {
        File logDir = new File("logs");
        if (!logDir.exists() && !logDir.mkdirs()) {
            System.err.println("WARNING: could not create logs directory");
        }
        String timestamp = new SimpleDateFormat("yyyyMMdd-HHmmss").format(new Date());

        // SINK 1: per-run log under logs/
        TraceBus.register(new JsonlTraceSink("logs/run-" + timestamp + ".jsonl"));
        // SINK 2: shared log in the working directory, appended on every run
        TraceBus.register(new JsonlTraceSink("course_trace.jsonl"));
    }

    static int crawl(String[] args) throws IOException {
        if (args.length < 1) {
            System.err.println(USAGE);
            return 2;
        }
        int pages = parseInt(args[0], "pages");
        Path dictFile = Paths.get(arg(args, 1, CourseStore.DEFAULT_DICTIONARY_FILE));
        Path indexFile = Paths.get(arg(args, 2, CourseStore.DEFAULT_INDEX_FILE));

        CrawlerConfig config = CrawlerConfig.builder().maxPages(pages).build();
        CrawlResult result = new CourseCrawler(config).crawl();

        CourseStore.saveDictionary(result.getDictionary(), dictFile);
        CourseStore.saveIndexRows(result.getRows(), indexFile);

        System.out.println("=== CRAWL COMPLETED (" + result.getTermination() + ") ===");
        System.out.println(result.getStats());
        System.out.println("Courses: " + result.getDictionary().size() + " -> " + dictFile);
        System.out.println("Index rows: " + result.getRows().size() + " -> " + indexFile);
        return 0;
    }

    static int search(String[] args) throws IOException {
        if (args.length < 1 || args[0].isBlank()) {
            System.err.println("ERROR: Query not specified!");
            System.err.println(USAGE);
            return 2;
        }
        String query = args[0];
        Path dictFile = Paths.get(arg(args, 1, CourseStore.DEFAULT_DICTIONARY_FILE));
        Path indexFile = Paths.get(arg(args, 2, CourseStore.DEFAULT_INDEX_FILE));
        int maxResults = args.length > 3 ? parseInt(args[3], "max_results") : 10;
        SearchMethod method = SearchMethod.fromName(arg(args, 4, null));

        CourseDictionary dictionary = CourseStore.loadDictionary(dictFile);
        InvertedIndex index = CourseStore.loadIndex(indexFile, dictionary);
        CourseSearchEngine engine = new CourseSearchEngine(dictionary, index, TextNormalizer.withDefaultStopWords());

        SearchStatistics stats = engine.statistics();
        System.out.println("=== COURSE SEARCH: '" + query + "' (" + method.externalName() + ") ===");
        System.out.println(stats);

        List<ScoreResult> results = engine.search(query, method, maxResults);
        if (results.isEmpty()) {
            System.out.println("No results.");
        }
        int rank = 1;
        for (ScoreResult result : results) {
            System.out.printf("%2d. %s%n", rank++, result);
        }

        SearchPerformance performance = engine.measurePerformance(query, maxResults);
        System.out.printf("Total time: %.2f ms, candidates: %d, coverage: %.1f%%, precision@%d: %.1f%%%n",
                performance.getTotalMillis(), performance.getCandidateCourses(),
                performance.getCoverage() * 100, maxResults, performance.getPrecisionAtK() * 100);
        return 0;
    }

    static int compare(String[] args) throws IOException {
        List<String> positional = new ArrayList<>();
        boolean showMetrics = false;
        boolean compareAll = false;
        for (String a : args) {
            if ("--metrics".equals(a)) showMetrics = true;
            else if ("--compare-all".equals(a)) compareAll = true;
            else positional.add(a);
        }
        if (positional.size() < 2) {
            System.err.println(USAGE);
            return 2;
        }
        String first = positional.get(0);
        String second = positional.get(1);
        Path dictFile = Paths.get(positional.size() > 2 ? positional.get(2) : CourseStore.DEFAULT_DICTIONARY_FILE);
        Path indexFile = Paths.get(positional.size() > 3 ? positional.get(3) : CourseStore.DEFAULT_INDEX_FILE);

        CourseDictionary dictionary = CourseStore.loadDictionary(dictFile);
        InvertedIndex index = CourseStore.loadIndex(indexFile, dictionary);
        CourseComparator comparator = new CourseComparator(dictionary, index,
                ResourceLoader.keywordCategories(), new RuntimeMemoryProbe());

        CourseRecord a = dictionary.require(first);
        CourseRecord b = dictionary.require(second);
        System.out.println("=== COURSE COMPARISON ===");
        System.out.println("1: " + a.getTitle());
        System.out.println("2: " + b.getTitle());

        if (compareAll) {
            Map<SimilarityMethod, PerformanceMetrics> all = comparator.compareAll(a, b);
            for (PerformanceMetrics metrics : all.values()) {
                System.out.println(metrics);
            }
        } else {
            for (SimilarityMethod method : SimilarityMethod.values()) {
                if (showMetrics) {
                    System.out.println(comparator.measure(a, b, method));
                } else {
                    System.out.printf("%-10s: %.4f%n", method.externalName(), comparator.compare(a, b, method));
                }
            }
        }

        System.out.println("=== SIMILAR TO '" + first + "' ===");
        int rank = 1;
        for (ScoreResult similar : comparator.findSimilar(first, 3, SimilarityMethod.DEFAULT)) {
            System.out.printf("%d. %s (similarity: %.4f)%n", rank++, similar.getTitle(), similar.getScore());
        }
        return 0;
    }

    private static String arg(String[] args, int position, String fallback) {
        return args.length > position ? args[position] : fallback;
    }

    private static int parseInt(String value, String name) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }
}
