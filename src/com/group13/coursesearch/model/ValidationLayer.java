package com.group13.coursesearch.model;

/*
  The three hard gates a page passes before it becomes a CourseRecord, in evaluation order.
 */
public enum ValidationLayer {

    // URL matches the course-page pattern and is not a listing/admin path.
    SYNTACTIC,

    // Title and description are present and the title is not a navigation label.
    STRUCTURAL,

    // The normalized word set reaches the minimum size.
    SEMANTIC
}
