package com.group13.coursesearch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/*
  Thematic keyword groups used by the semantic similarity metric.
  Category name -> normalized terms that signal the theme.
  Loaded once from configuration and shared read-only.
 */
public class KeywordCategories {

    private final Map<String, Set<String>> categories;

    public KeywordCategories(Map<String, ? extends Set<String>> categories) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Set<String>> entry : categories.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        this.categories = Collections.unmodifiableMap(copy);
    }

    // Names of the categories for which the word set holds at least one term.
    public Set<String> categoriesOf(Set<String> words) {
        Set<String> matched = new LinkedHashSet<>();
        for (Map.Entry<String, Set<String>> entry : categories.entrySet()) {
            for (String term : entry.getValue()) {
                if (words.contains(term)) {
                    matched.add(entry.getKey());
                    break;
                }
            }
        }
        return matched;
    }

    public Set<String> names() {
        return categories.keySet();
    }

    public Set<String> terms(String category) {
        Set<String> terms = categories.get(category);
        return terms != null ? terms : Collections.emptySet();
    }

    public int size() {
        return categories.size();
    }
}
