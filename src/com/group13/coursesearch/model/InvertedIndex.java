package com.group13.coursesearch.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/*
  Represents the inverted index (catalog) used for candidate retrieval.
  Maps every normalized word to the set of course ids whose word set contains it.
  Built once from a finished CourseDictionary and never mutated afterwards.
 */
public class InvertedIndex {

    private final Map<String, Set<String>> postings;

    public InvertedIndex(Map<String, ? extends Set<String>> postings) {
        Map<String, Set<String>> copy = new HashMap<>();
        for (Map.Entry<String, ? extends Set<String>> entry : postings.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        this.postings = Collections.unmodifiableMap(copy);
    }

    // Course ids containing the word; empty when the word is unknown.
    public Set<String> postings(String word) {
        Set<String> ids = postings.get(word);
        return ids != null ? ids : Collections.emptySet();
    }

    public boolean containsWord(String word) {
        return postings.containsKey(word);
    }

    // Document frequency of the word.
    public int documentFrequency(String word) {
        return postings(word).size();
    }

    public Set<String> vocabulary() {
        return postings.keySet();
    }

    // Total number of (word, course) entries.
    public int entryCount() {
        int total = 0;
        for (Set<String> ids : postings.values()) {
            total += ids.size();
        }
        return total;
    }

    public Map<String, Set<String>> asMap() {
        return postings;
    }
}
