package com.group13.coursesearch.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/*
  Represents one crawled course page after normalization.
  This is the atomic unit of indexing, search and comparison.
  Instances are created once by the crawler and never modified afterwards.
 */
public class CourseRecord {

    private final String courseId;     // Slug derived from the URL (stable per URL)
    private final String url;          // Address the course was fetched from
    private final String title;        // Display title of the course
    private final String description;  // Extracted description text (may be empty)
    private final Set<String> words;   // Normalized, de-duplicated tokens of title + description

    public CourseRecord(String courseId, String url, String title, String description, Set<String> words) {
        this.courseId = courseId;
        this.url = url;
        this.title = title != null ? title : "";
        this.description = description != null ? description : "";
        this.words = Collections.unmodifiableSet(new LinkedHashSet<>(words));
    }

    // Getters

    public String getCourseId() { return courseId; }

    public String getUrl() { return url; }

    public String getTitle() { return title; }

    public String getDescription() { return description; }

    public Set<String> getWords() { return words; }

    public boolean contains(String word) {
        return words.contains(word);
    }

    @Override
    public String toString() {
        return courseId + " (" + words.size() + " words) " + url;
    }
}
