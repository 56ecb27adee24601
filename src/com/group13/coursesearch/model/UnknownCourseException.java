package com.group13.coursesearch.model;

/**
 * Raised when a course identifier is referenced that the dictionary does not hold.
 * The failing call is aborted; nothing is substituted for the missing record.
 */
public class UnknownCourseException extends RuntimeException {

    private final String courseId;

    public UnknownCourseException(String courseId) {
        super("Unknown course id: " + courseId);
        this.courseId = courseId;
    }

    public String getCourseId() {
        return courseId;
    }
}
