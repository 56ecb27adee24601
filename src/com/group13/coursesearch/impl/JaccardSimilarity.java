package com.group13.coursesearch.impl;

import com.group13.coursesearch.core.SimilarityMetric;
import com.group13.coursesearch.model.CourseRecord;

import java.util.Set;

/**
 * |A ∩ B| / |A ∪ B|. Two empty word sets score 0.
 */
public class JaccardSimilarity implements SimilarityMetric {

    @Override
    public double similarity(CourseRecord first, CourseRecord second) {
        return jaccard(first.getWords(), second.getWords());
    }

    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        int intersection = intersectionSize(a, b);
        int union = a.size() + b.size() - intersection;
        return union > 0 ? (double) intersection / union : 0.0;
    }

    public static int intersectionSize(Set<String> a, Set<String> b) {
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int count = 0;
        for (String word : smaller) {
            if (larger.contains(word)) count++;
        }
        return count;
    }
}
