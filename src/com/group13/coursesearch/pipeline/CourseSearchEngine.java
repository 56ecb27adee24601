package com.group13.coursesearch.pipeline;

import com.group13.coursesearch.core.Normalizer;
import com.group13.coursesearch.core.Ranker;
import com.group13.coursesearch.impl.CosineRanker;
import com.group13.coursesearch.impl.RelevanceRanker;
import com.group13.coursesearch.impl.SmartRanker;
import com.group13.coursesearch.impl.TfIdfRanker;
import com.group13.coursesearch.model.CourseDictionary;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.IdfTable;
import com.group13.coursesearch.model.InvertedIndex;
import com.group13.coursesearch.model.ScoreResult;
import com.group13.coursesearch.model.SearchMethod;
import com.group13.coursesearch.model.SearchPerformance;
import com.group13.coursesearch.model.SearchStatistics;
import com.group13.coursesearch.tracing.TraceBus;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ranked search over a finished dictionary and its inverted index.
 * <p>
 * The dictionary, index and IDF table are read-only after construction, so one engine
 * can serve concurrent searches.
 */
public class CourseSearchEngine {

    private final CourseDictionary dictionary;
    private final InvertedIndex index;
    private final Normalizer normalizer;
    private final IdfTable idf;
    private final Map<SearchMethod, Ranker> rankers = new EnumMap<>(SearchMethod.class);

    public CourseSearchEngine(CourseDictionary dictionary, InvertedIndex index, Normalizer normalizer) {
        this.dictionary = dictionary;
        this.index = index;
        this.normalizer = normalizer;
        this.idf = IdfTable.from(dictionary, index);

        rankers.put(SearchMethod.RELEVANCE, new RelevanceRanker());
        rankers.put(SearchMethod.COSINE, new CosineRanker(idf));
        rankers.put(SearchMethod.TFIDF, new TfIdfRanker(idf));
        rankers.put(SearchMethod.SMART, new SmartRanker(idf));
    }

    public List<ScoreResult> search(String query, SearchMethod method, int maxResults) {
        return search(query, method, maxResults, null);
    }

    /**
     * Runs a ranked search.
     *
     * @param query      free text, normalized the same way as course text
     * @param method     scoring method
     * @param maxResults maximum number of results; {@code <= 0} yields an empty list
     * @param minScore   optional lower bound on the score, {@code null} keeps every positive score
     * @return results in ranking order
     * @throws com.group13.coursesearch.model.UnknownCourseException if the index names a course
     *         that the dictionary does not hold
     */
    public List<ScoreResult> search(String query, SearchMethod method, int maxResults, Double minScore) {
        long start = System.currentTimeMillis();

        // 1. Query normalization
        List<String> tokens = normalizer.normalize(query == null ? "" : query);
        TraceBus.push("QUERY", "method=" + method.externalName() + ", tokens=" + tokens);
        if (tokens.isEmpty() || maxResults <= 0) {
            return Collections.emptyList();
        }

        // 2. Candidate generation
        Set<String> candidates = candidatesFor(tokens);
        TraceBus.push("CANDIDATES", "Candidate courses: " + candidates.size());
        if (candidates.isEmpty()) {
            return Collections.emptyList();
        }

        // 3. Scoring, filtering and ordering
        Ranker ranker = rankers.get(method);
        List<ScoreResult> scored = score(ranker, candidates, tokens, minScore);
        List<ScoreResult> results = new ArrayList<>(scored.subList(0, Math.min(maxResults, scored.size())));

        TraceBus.pushFull("RANK", query, results.isEmpty()
                ? "No results"
                : "Returned " + results.size() + " of " + scored.size() + ", best=" + results.get(0).getCourseId(),
                System.currentTimeMillis() - start, null);
        return results;
    }

    public List<String> searchUrls(String query, SearchMethod method, int maxResults) {
        List<String> urls = new ArrayList<>();
        for (ScoreResult result : search(query, method, maxResults)) {
            urls.add(result.getUrl());
        }
        return urls;
    }

    /**
     * Cosine search restricted to courses whose title or description mentions the category.
     * Twice {@code maxResults} hits are ranked first so that filtering still leaves a full page.
     *
     * @param category free text; a hit matches when its text contains the whole category or any
     *                 of its words. {@code null} or blank disables the filter.
     */
    public List<ScoreResult> searchByCategory(String query, String category, int maxResults) {
        List<ScoreResult> ranked = search(query, SearchMethod.COSINE, Math.max(0, maxResults) * 2);
        if (category == null || category.isBlank()) {
            return new ArrayList<>(ranked.subList(0, Math.min(Math.max(0, maxResults), ranked.size())));
        }

        String wanted = category.trim().toLowerCase(Locale.ROOT);
        String[] wantedWords = wanted.split("\\s+");
        List<ScoreResult> filtered = new ArrayList<>();
        for (ScoreResult result : ranked) {
            if (filtered.size() == maxResults) break;
            String text = (result.getTitle() + " " + dictionary.require(result.getCourseId()).getDescription())
                    .toLowerCase(Locale.ROOT);
            if (text.contains(wanted) || Arrays.stream(wantedWords).anyMatch(text::contains)) {
                filtered.add(result);
            }
        }
        TraceBus.push("CATEGORY", "category=" + wanted + ", kept " + filtered.size() + " of " + ranked.size());
        return filtered;
    }

    public SearchStatistics statistics() {
        int totalWords = 0;
        for (CourseRecord course : dictionary.records()) {
            totalWords += course.getWords().size();
        }
        double average = dictionary.isEmpty() ? 0.0 : (double) totalWords / dictionary.size();
        return new SearchStatistics(dictionary.size(), index.vocabulary().size(), index.entryCount(), average);
    }

    /*
      Same steps as search() with the smart ranker, timed one by one.
     */
    public SearchPerformance measurePerformance(String query, int maxResults) {
        long t0 = System.nanoTime();
        List<String> tokens = normalizer.normalize(query == null ? "" : query);
        long t1 = System.nanoTime();
        Set<String> candidates = tokens.isEmpty() ? Collections.emptySet() : candidatesFor(tokens);
        long t2 = System.nanoTime();
        List<ScoreResult> scored = candidates.isEmpty()
                ? Collections.emptyList()
                : score(rankers.get(SearchMethod.SMART), candidates, tokens, null);
        long t3 = System.nanoTime();

        List<ScoreResult> returned = scored.subList(0, Math.max(0, Math.min(maxResults, scored.size())));
        int relevant = 0;
        double scoreSum = 0.0;
        for (ScoreResult result : returned) {
            scoreSum += result.getScore();
            if (result.getScore() > SearchPerformance.RELEVANCE_THRESHOLD) relevant++;
        }

        double coverage = dictionary.isEmpty() ? 0.0 : (double) candidates.size() / dictionary.size();
        double precision = returned.isEmpty() ? 0.0 : (double) relevant / returned.size();
        double averageScore = returned.isEmpty() ? 0.0 : scoreSum / returned.size();

        SearchPerformance performance = new SearchPerformance(query, tokens,
                millis(t1 - t0), millis(t2 - t1), millis(t3 - t2), millis(t3 - t0),
                candidates.size(), scored.size(), returned.size(),
                coverage, precision, averageScore);
        TraceBus.pushFull("RANK", query, "precision@k=" + precision + ", coverage=" + coverage,
                (long) performance.getTotalMillis(), null);
        return performance;
    }

    public CourseDictionary getDictionary() {
        return dictionary;
    }

    public InvertedIndex getIndex() {
        return index;
    }

    public IdfTable getIdf() {
        return idf;
    }

    // Union of the postings of every query token, in first-seen order.
    private Set<String> candidatesFor(List<String> tokens) {
        Set<String> candidates = new LinkedHashSet<>();
        for (String token : tokens) {
            candidates.addAll(index.postings(token));
        }
        return candidates;
    }

    private List<ScoreResult> score(Ranker ranker, Set<String> candidates, List<String> tokens, Double minScore) {
        List<ScoreResult> scored = new ArrayList<>();
        for (String courseId : candidates) {
            ScoreResult result = ranker.score(dictionary.require(courseId), tokens);
            if (result.getScore() <= 0.0) continue;
            if (minScore != null && result.getScore() < minScore) continue;
            scored.add(result);
        }
        scored.sort(ranker.ordering());
        return scored;
    }

    private static double millis(long nanos) {
        return nanos / 1_000_000.0;
    }
}
