package com.group13.coursesearch.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/*
  The closed set of search ranking methods.
  Parsed once from user input; an unsupported name fails here instead of at scoring time.
 */
public enum SearchMethod {

    // matches / |query tokens|
    RELEVANCE,

    // Cosine between the query vector and the course TF-IDF vector.
    COSINE,

    // Accumulated TF-IDF weight of the query tokens inside the course.
    TFIDF,

    // coverage * 10 + cosine; coverage dominates, cosine breaks ties. Recommended default.
    SMART;

    public static final SearchMethod DEFAULT = SMART;

    public String externalName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SearchMethod fromName(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT;
        }
        for (SearchMethod method : values()) {
            if (method.externalName().equals(name.trim().toLowerCase(Locale.ROOT))) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown search method: " + name + ". Available: "
                + Arrays.stream(values()).map(SearchMethod::externalName).collect(Collectors.joining(", ")));
    }
}
