package com.group13.coursesearch.impl;

import com.group13.coursesearch.core.Ranker;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.IdfTable;
import com.group13.coursesearch.model.ScoreResult;

import java.util.Comparator;
import java.util.List;

/**
 * Hybrid ranking: score = coverage * 10 + cosine.
 * Coverage (distinct query tokens matched / distinct query tokens) dominates the order,
 * cosine only separates courses with equal coverage.
 */
public class SmartRanker implements Ranker {

    public static final double COVERAGE_WEIGHT = 10.0;

    // Coverage first, so long queries (where 10 / |q| < 1) still keep coverage dominant.
    private static final Comparator<ScoreResult> ORDER =
            Comparator.comparing(ScoreResult::getCoverage, Comparator.reverseOrder())
                    .thenComparing(Comparator.naturalOrder());

    private final CosineRanker cosineRanker;

    public SmartRanker(IdfTable idf) {
        this.cosineRanker = new CosineRanker(idf);
    }

    @Override
    public ScoreResult score(CourseRecord course, List<String> queryTokens) {
        int total = TfIdfVectors.distinctCount(queryTokens);
        if (total == 0) {
            return new ScoreResult(course, 0.0, 0.0, 0.0);
        }

        // 1. Query coverage (dominant)
        double coverage = (double) TfIdfVectors.distinctMatches(queryTokens, course.getWords()) / total;

        // 2. Cosine as tie-breaker
        double cosine = cosineRanker.cosine(course, queryTokens);

        return new ScoreResult(course, coverage * COVERAGE_WEIGHT + cosine, coverage, cosine);
    }

    @Override
    public Comparator<ScoreResult> ordering() {
        return ORDER;
    }
}
