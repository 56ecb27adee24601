package com.group13.coursesearch.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/*
  The closed set of course-to-course similarity methods.
  Each constant carries the cost label reported in the performance metrics
  (n, m = word counts of the two courses, V = vocabulary size, k = keyword categories).
 */
public enum SimilarityMethod {

    JACCARD("O(n + m)"),
    COSINE("O(V)"),
    OVERLAP("O(n + m)"),
    SEMANTIC("O(n + m + k)"),
    COMBINED("O(V + n + m + k)");

    public static final SimilarityMethod DEFAULT = COMBINED;

    private final String complexity;

    SimilarityMethod(String complexity) {
        this.complexity = complexity;
    }

    public String getComplexity() {
        return complexity;
    }

    public String externalName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SimilarityMethod fromName(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT;
        }
        for (SimilarityMethod method : values()) {
            if (method.externalName().equals(name.trim().toLowerCase(Locale.ROOT))) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown similarity method: " + name + ". Available: "
                + Arrays.stream(values()).map(SimilarityMethod::externalName).collect(Collectors.joining(", ")));
    }
}
