package com.group13.coursesearch.impl;

import com.group13.coursesearch.core.Ranker;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.ScoreResult;

import java.util.List;

/**
 * Plain relevance: distinct query tokens present in the course / distinct query tokens.
 * Range [0, 1]; 1.0 only when the course contains every query token.
 */
public class RelevanceRanker implements Ranker {

    @Override
    public ScoreResult score(CourseRecord course, List<String> queryTokens) {
        int total = TfIdfVectors.distinctCount(queryTokens);
        if (total == 0) {
            return new ScoreResult(course, 0.0);
        }
        int matches = TfIdfVectors.distinctMatches(queryTokens, course.getWords());
        return new ScoreResult(course, (double) matches / total);
    }
}
