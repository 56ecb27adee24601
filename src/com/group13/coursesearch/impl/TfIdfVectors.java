package com.group13.coursesearch.impl;

import com.group13.coursesearch.model.IdfTable;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Vector-space helpers shared by the TF-IDF based rankers and similarity metrics.
 * A course word set is binary (each word occurs once), so its TF-IDF weight per word is its IDF.
 * A zero-norm vector yields a cosine of 0.
 */
public final class TfIdfVectors {

    private TfIdfVectors() {
    }

    /*
      Cosine between a query and a course.
      Query vector: raw token counts. Course vector: IDF weight of every course word.
     */
    public static double queryCosine(List<String> queryTokens, Set<String> courseWords, IdfTable idf) {
        if (queryTokens.isEmpty() || courseWords.isEmpty()) {
            return 0.0;
        }

        Map<String, Integer> queryCounts = new HashMap<>();
        for (String token : queryTokens) {
            queryCounts.merge(token, 1, Integer::sum);
        }

        double dot = 0.0;
        double queryNorm = 0.0;
        for (Map.Entry<String, Integer> entry : queryCounts.entrySet()) {
            int count = entry.getValue();
            queryNorm += (double) count * count;
            if (courseWords.contains(entry.getKey())) {
                dot += count * idf.idf(entry.getKey());
            }
        }

        double courseNorm = norm(courseWords, idf);
        if (queryNorm == 0.0 || courseNorm == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(queryNorm) * courseNorm);
    }

    // Cosine between two courses' IDF-weighted vectors.
    public static double courseCosine(Set<String> first, Set<String> second, IdfTable idf) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = first.size() <= second.size() ? first : second;
        Set<String> larger = smaller == first ? second : first;

        double dot = 0.0;
        for (String word : smaller) {
            if (larger.contains(word)) {
                double weight = idf.idf(word);
                dot += weight * weight;
            }
        }

        double norm1 = norm(first, idf);
        double norm2 = norm(second, idf);
        if (norm1 == 0.0 || norm2 == 0.0) {
            return 0.0;
        }
        // Rounding can push identical vectors a hair above 1
        return Math.min(1.0, dot / (norm1 * norm2));
    }

    public static double norm(Set<String> words, IdfTable idf) {
        double sum = 0.0;
        for (String word : words) {
            double weight = idf.idf(word);
            sum += weight * weight;
        }
        return Math.sqrt(sum);
    }

    // Number of distinct query tokens found in the course.
    public static int distinctMatches(List<String> queryTokens, Set<String> courseWords) {
        int matches = 0;
        for (String token : new LinkedHashSet<>(queryTokens)) {
            if (courseWords.contains(token)) matches++;
        }
        return matches;
    }

    public static int distinctCount(List<String> queryTokens) {
        return new HashSet<>(queryTokens).size();
    }
}
