package com.group13.coursesearch.pipeline;

import com.group13.coursesearch.core.MemoryProbe;
import com.group13.coursesearch.core.SimilarityMetric;
import com.group13.coursesearch.impl.CombinedSimilarity;
import com.group13.coursesearch.impl.JaccardSimilarity;
import com.group13.coursesearch.impl.KeywordSemanticSimilarity;
import com.group13.coursesearch.impl.OverlapSimilarity;
import com.group13.coursesearch.impl.TfIdfCosineSimilarity;
import com.group13.coursesearch.model.CourseDictionary;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.IdfTable;
import com.group13.coursesearch.model.InvertedIndex;
import com.group13.coursesearch.model.KeywordCategories;
import com.group13.coursesearch.model.PerformanceMetrics;
import com.group13.coursesearch.model.ScoreResult;
import com.group13.coursesearch.model.SimilarityMethod;
import com.group13.coursesearch.tracing.TraceBus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Pairwise course similarity with optional timing and memory instrumentation.
 * Scores are in [0, 1]. Instrumentation never changes a score and never fails a comparison.
 */
public class CourseComparator {

    private final CourseDictionary dictionary;
    private final MemoryProbe memoryProbe;
    private final Map<SimilarityMethod, SimilarityMetric> metrics = new EnumMap<>(SimilarityMethod.class);

    public CourseComparator(CourseDictionary dictionary, InvertedIndex index,
                            KeywordCategories categories, MemoryProbe memoryProbe) {
        this.dictionary = dictionary;
        this.memoryProbe = memoryProbe;

        IdfTable idf = IdfTable.from(dictionary, index);
        SimilarityMetric jaccard = new JaccardSimilarity();
        SimilarityMetric cosine = new TfIdfCosineSimilarity(idf);
        SimilarityMetric semantic = new KeywordSemanticSimilarity(categories);

        metrics.put(SimilarityMethod.JACCARD, jaccard);
        metrics.put(SimilarityMethod.COSINE, cosine);
        metrics.put(SimilarityMethod.OVERLAP, new OverlapSimilarity());
        metrics.put(SimilarityMethod.SEMANTIC, semantic);
        metrics.put(SimilarityMethod.COMBINED, new CombinedSimilarity(jaccard, cosine, semantic));
    }

    public double compare(CourseRecord first, CourseRecord second, SimilarityMethod method) {
        double score = metrics.get(method).similarity(first, second);
        TraceBus.push("COMPARE", method.externalName() + "(" + first.getCourseId() + ", "
                + second.getCourseId() + ") = " + score);
        return score;
    }

    /**
     * Compares two courses of the dictionary by id.
     *
     * @throws com.group13.coursesearch.model.UnknownCourseException if either id is missing
     */
    public double compare(String firstId, String secondId, SimilarityMethod method) {
        return compare(dictionary.require(firstId), dictionary.require(secondId), method);
    }

    public PerformanceMetrics measure(CourseRecord first, CourseRecord second, SimilarityMethod method) {
        SimilarityMetric metric = metrics.get(method);

        // 1. Instrumented computation
        long memoryBefore = readMemory();
        long start = System.nanoTime();
        double score = metric.similarity(first, second);
        long elapsed = System.nanoTime() - start;
        long memoryAfter = readMemory();

        // 2. Vocabulary figures
        int shared = JaccardSimilarity.intersectionSize(first.getWords(), second.getWords());
        int union = first.getWords().size() + second.getWords().size() - shared;
        double overlap = union > 0 ? (double) shared / union : 0.0;

        // A collection between the two readings can make the difference negative
        long memoryDelta = Math.max(0L, memoryAfter - memoryBefore);

        PerformanceMetrics result = new PerformanceMetrics(method, score,
                first.getWords().size(), second.getWords().size(), shared, overlap, elapsed, memoryDelta);
        TraceBus.pushFull("MEASURE", first.getCourseId() + " vs " + second.getCourseId(),
                result.toString(), elapsed / 1_000_000, null);
        return result;
    }

    public PerformanceMetrics measure(String firstId, String secondId, SimilarityMethod method) {
        return measure(dictionary.require(firstId), dictionary.require(secondId), method);
    }

    // One measurement per method, in declaration order.
    public Map<SimilarityMethod, PerformanceMetrics> compareAll(CourseRecord first, CourseRecord second) {
        Map<SimilarityMethod, PerformanceMetrics> all = new EnumMap<>(SimilarityMethod.class);
        for (SimilarityMethod method : SimilarityMethod.values()) {
            all.put(method, measure(first, second, method));
        }
        return all;
    }

    public Map<SimilarityMethod, PerformanceMetrics> compareAll(String firstId, String secondId) {
        return compareAll(dictionary.require(firstId), dictionary.require(secondId));
    }

    /**
     * Ranks every other course of the dictionary by its similarity to the given one.
     *
     * @param courseId the reference course
     * @param topK     maximum number of results; {@code <= 0} yields an empty list
     * @param method   similarity method
     * @return results sorted by score descending, ties broken by course id
     */
    public List<ScoreResult> findSimilar(String courseId, int topK, SimilarityMethod method) {
        CourseRecord target = dictionary.require(courseId);
        SimilarityMetric metric = metrics.get(method);

        List<ScoreResult> results = new ArrayList<>();
        if (topK <= 0) {
            return results;
        }
        for (CourseRecord other : dictionary.records()) {
            if (other.getCourseId().equals(courseId)) continue;
            results.add(new ScoreResult(other, metric.similarity(target, other)));
        }
        results.sort(Comparator.comparingDouble(ScoreResult::getScore).reversed()
                .thenComparing(ScoreResult::getCourseId));

        List<ScoreResult> top = new ArrayList<>(results.subList(0, Math.min(topK, results.size())));
        TraceBus.push("COMPARE", "similar to " + courseId + " by " + method.externalName() + ": " + top.size());
        return top;
    }

    // A probe that cannot measure reads as 0.
    private long readMemory() {
        try {
            return memoryProbe.usedBytes();
        } catch (RuntimeException e) {
            TraceBus.error("MEASURE", "memory probe", e.toString());
            return 0L;
        }
    }

    public CourseDictionary getDictionary() {
        return dictionary;
    }
}
