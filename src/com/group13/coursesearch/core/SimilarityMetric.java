package com.group13.coursesearch.core;

import com.group13.coursesearch.model.CourseRecord;

/**
 * Strategy Interface for course-to-course similarity.
 * Implementations are symmetric in their arguments and return values in [0, 1].
 */
public interface SimilarityMetric {
    double similarity(CourseRecord first, CourseRecord second);
}
