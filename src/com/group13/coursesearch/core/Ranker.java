package com.group13.coursesearch.core;

import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.ScoreResult;

import java.util.Comparator;
import java.util.List;

/**
 * Strategy Interface for the search scoring stage.
 * One implementation exists per search method. Implementations hold only read-only
 * corpus data, so a single instance may score candidates for concurrent queries.
 */
public interface Ranker {

    // Scores one candidate course against the normalized query tokens.
    ScoreResult score(CourseRecord course, List<String> queryTokens);

    // Order in which scored candidates are returned.
    default Comparator<ScoreResult> ordering() {
        return Comparator.naturalOrder();
    }
}
