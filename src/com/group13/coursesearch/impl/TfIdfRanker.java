package com.group13.coursesearch.impl;

import com.group13.coursesearch.core.Ranker;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.IdfTable;
import com.group13.coursesearch.model.ScoreResult;

import java.util.List;

/**
 * Accumulated TF-IDF weight of the query tokens in the course.
 * tf = occurrences / course word count, where every course word occurs once.
 */
public class TfIdfRanker implements Ranker {

    private final IdfTable idf;

    public TfIdfRanker(IdfTable idf) {
        this.idf = idf;
    }

    @Override
    public ScoreResult score(CourseRecord course, List<String> queryTokens) {
        int courseSize = course.getWords().size();
        if (courseSize == 0) {
            return new ScoreResult(course, 0.0);
        }
        double total = 0.0;
        for (String token : queryTokens) {
            if (course.contains(token)) {
                total += (1.0 / courseSize) * idf.idf(token);
            }
        }
        return new ScoreResult(course, total);
    }
}
