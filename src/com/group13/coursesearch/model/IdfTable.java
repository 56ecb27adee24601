package com.group13.coursesearch.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/*
  Inverse document frequency per word: log(totalCourses / coursesContainingWord).
  Computed once for a corpus snapshot and handed to every TF-IDF based routine
  as a read-only argument.
 */
public class IdfTable {

    private final Map<String, Double> idf;
    private final int totalCourses;

    private IdfTable(Map<String, Double> idf, int totalCourses) {
        this.idf = Collections.unmodifiableMap(idf);
        this.totalCourses = totalCourses;
    }

    public static IdfTable from(CourseDictionary dictionary, InvertedIndex index) {
        int total = dictionary.size();
        Map<String, Double> values = new HashMap<>();
        for (Map.Entry<String, Set<String>> entry : index.asMap().entrySet()) {
            int df = entry.getValue().size();
            values.put(entry.getKey(), df > 0 && total > 0 ? Math.log((double) total / df) : 0.0);
        }
        return new IdfTable(values, total);
    }

    // Words outside the corpus vocabulary weigh 0.
    public double idf(String word) {
        return idf.getOrDefault(word, 0.0);
    }

    public int getTotalCourses() {
        return totalCourses;
    }

    public int size() {
        return idf.size();
    }
}
