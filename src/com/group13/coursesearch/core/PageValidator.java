package com.group13.coursesearch.core;

import com.group13.coursesearch.model.CoursePage;
import com.group13.coursesearch.model.ValidationResult;

/**
 * Strategy Interface for deciding whether a fetched page is a real course.
 * Each failure is reported as a rejected result naming the gate that failed;
 * implementations never throw for invalid content.
 */
public interface PageValidator {
    ValidationResult validate(CoursePage page);
}
