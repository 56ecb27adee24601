package com.group13.coursesearch.impl;

import com.group13.coursesearch.core.Ranker;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.IdfTable;
import com.group13.coursesearch.model.ScoreResult;

import java.util.List;

/**
 * Cosine similarity between the query vector and the course TF-IDF vector.
 * A single rare-term match can outrank a multi-term match here; see {@link SmartRanker}.
 */
public class CosineRanker implements Ranker {

    private final IdfTable idf;

    public CosineRanker(IdfTable idf) {
        this.idf = idf;
    }

    @Override
    public ScoreResult score(CourseRecord course, List<String> queryTokens) {
        return new ScoreResult(course, cosine(course, queryTokens));
    }

    double cosine(CourseRecord course, List<String> queryTokens) {
        return TfIdfVectors.queryCosine(queryTokens, course.getWords(), idf);
    }
}
