package com.group13.coursesearch.impl;

import com.group13.coursesearch.core.SimilarityMetric;
import com.group13.coursesearch.model.CourseRecord;

import java.util.Set;

/**
 * Overlap coefficient: |A ∩ B| / min(|A|, |B|).
 * A small course fully contained in a large one scores 1.0 even though the sets differ a lot.
 */
public class OverlapSimilarity implements SimilarityMetric {

    @Override
    public double similarity(CourseRecord first, CourseRecord second) {
        Set<String> a = first.getWords();
        Set<String> b = second.getWords();
        int minSize = Math.min(a.size(), b.size());
        if (minSize == 0) {
            return 0.0;
        }
        return (double) JaccardSimilarity.intersectionSize(a, b) / minSize;
    }
}
