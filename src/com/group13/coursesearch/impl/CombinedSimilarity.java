package com.group13.coursesearch.impl;

import com.group13.coursesearch.core.SimilarityMetric;
import com.group13.coursesearch.model.CourseRecord;

/**
 * Fixed blend: 0.3 * jaccard + 0.3 * cosine + 0.4 * semantic.
 * Recommended for course-to-course comparison.
 */
public class CombinedSimilarity implements SimilarityMetric {

    public static final double JACCARD_WEIGHT = 0.3;
    public static final double COSINE_WEIGHT = 0.3;
    public static final double SEMANTIC_WEIGHT = 0.4;

    private final SimilarityMetric jaccard;
    private final SimilarityMetric cosine;
    private final SimilarityMetric semantic;

    public CombinedSimilarity(SimilarityMetric jaccard, SimilarityMetric cosine, SimilarityMetric semantic) {
        this.jaccard = jaccard;
        this.cosine = cosine;
        this.semantic = semantic;
    }

    @Override
    public double similarity(CourseRecord first, CourseRecord second) {
        return JACCARD_WEIGHT * jaccard.similarity(first, second)
                + COSINE_WEIGHT * cosine.similarity(first, second)
                + SEMANTIC_WEIGHT * semantic.similarity(first, second);
    }
}
