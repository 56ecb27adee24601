package com.group13.coursesearch.impl;

import com.group13.coursesearch.core.SimilarityMetric;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.IdfTable;

/**
 * Cosine between the TF-IDF vectors of two courses over the corpus vocabulary.
 */
public class TfIdfCosineSimilarity implements SimilarityMetric {

    private final IdfTable idf;

    public TfIdfCosineSimilarity(IdfTable idf) {
        this.idf = idf;
    }

    @Override
    public double similarity(CourseRecord first, CourseRecord second) {
        return TfIdfVectors.courseCosine(first.getWords(), second.getWords(), idf);
    }
}
