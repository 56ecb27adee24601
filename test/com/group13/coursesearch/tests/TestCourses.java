package com.group13.coursesearch.tests;

import com.group13.coursesearch.model.CourseDictionary;
import com.group13.coursesearch.model.CourseRecord;

import java.util.Arrays;
import java.util.LinkedHashSet;

// Shared fixtures for the search and comparison tests.
final class TestCourses {

    private TestCourses() {
    }

    static CourseRecord course(String id, String title, String... words) {
        return new CourseRecord(id, "https://example.edu/" + id, title, "", new LinkedHashSet<>(Arrays.asList(words)));
    }

    static CourseDictionary dictionary(CourseRecord... records) {
        return CourseDictionary.of(Arrays.asList(records));
    }
}
