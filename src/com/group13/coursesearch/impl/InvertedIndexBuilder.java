package com.group13.coursesearch.impl;

import com.group13.coursesearch.model.CourseDictionary;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.IndexRow;
import com.group13.coursesearch.model.InvertedIndex;
import com.group13.coursesearch.model.UnknownCourseException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the inverted index and the flat (course_id, word) relation from a finished dictionary.
 * A single pass over every (course, word) pair: O(total words across all courses).
 */
public final class InvertedIndexBuilder {

    private InvertedIndexBuilder() {
    }

    public static InvertedIndex build(CourseDictionary dictionary) {
        Map<String, Set<String>> postings = new HashMap<>();
        for (CourseRecord course : dictionary.records()) {
            for (String word : course.getWords()) {
                postings.computeIfAbsent(word, w -> new LinkedHashSet<>()).add(course.getCourseId());
            }
        }
        return new InvertedIndex(postings);
    }

    /**
     * Builds the index from stored rows, checking each row against the dictionary.
     *
     * @throws UnknownCourseException if a row names a course the dictionary does not hold
     */
    public static InvertedIndex fromRows(Collection<IndexRow> rows, CourseDictionary dictionary) {
        Map<String, Set<String>> postings = new HashMap<>();
        for (IndexRow row : rows) {
            if (!dictionary.contains(row.getCourseId())) {
                throw new UnknownCourseException(row.getCourseId());
            }
            postings.computeIfAbsent(row.getWord(), w -> new LinkedHashSet<>()).add(row.getCourseId());
        }
        return new InvertedIndex(postings);
    }

    // One row per unique pair, grouped by course in dictionary order, words sorted.
    public static List<IndexRow> rows(CourseDictionary dictionary) {
        Set<IndexRow> unique = new LinkedHashSet<>();
        for (CourseRecord course : dictionary.records()) {
            for (String word : new TreeSet<>(course.getWords())) {
                unique.add(new IndexRow(course.getCourseId(), word));
            }
        }
        return new ArrayList<>(unique);
    }
}
