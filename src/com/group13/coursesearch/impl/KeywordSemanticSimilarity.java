package com.group13.coursesearch.impl;

import com.group13.coursesearch.core.SimilarityMetric;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.KeywordCategories;

import java.util.HashSet;
import java.util.Set;

/**
 * Thematic similarity from fixed keyword categories.
 * keywordSimilarity = categories hit by both courses / categories hit by either course,
 * 1 when neither course hits a category and 0 when only one does;
 * semantic = 0.6 * keywordSimilarity + 0.4 * jaccard.
 */
public class KeywordSemanticSimilarity implements SimilarityMetric {

    public static final double KEYWORD_WEIGHT = 0.6;
    public static final double JACCARD_WEIGHT = 0.4;

    private final KeywordCategories categories;

    public KeywordSemanticSimilarity(KeywordCategories categories) {
        this.categories = categories;
    }

    @Override
    public double similarity(CourseRecord first, CourseRecord second) {
        double keywordSimilarity = keywordSimilarity(first.getWords(), second.getWords());
        double jaccard = JaccardSimilarity.jaccard(first.getWords(), second.getWords());
        return KEYWORD_WEIGHT * keywordSimilarity + JACCARD_WEIGHT * jaccard;
    }

    public double keywordSimilarity(Set<String> a, Set<String> b) {
        Set<String> themesA = categories.categoriesOf(a);
        Set<String> themesB = categories.categoriesOf(b);

        if (themesA.isEmpty() && themesB.isEmpty()) {
            return 1.0;
        }
        if (themesA.isEmpty() || themesB.isEmpty()) {
            return 0.0;
        }

        Set<String> either = new HashSet<>(themesA);
        either.addAll(themesB);

        Set<String> both = new HashSet<>(themesA);
        both.retainAll(themesB);
        return (double) both.size() / either.size();
    }
}
