package com.group13.coursesearch.model;

import java.util.Objects;

/*
  One row of the flat index relation: a (course_id, word) pair.
  Rows are unique on the pair; equals/hashCode make that checkable with a Set.
 */
public class IndexRow implements Comparable<IndexRow> {

    private final String courseId;  // Identifier of the course containing the word
    private final String word;      // Normalized word

    public IndexRow(String courseId, String word) {
        this.courseId = courseId;
        this.word = word;
    }

    // Getters
    public String getCourseId() { return courseId; }
    public String getWord() { return word; }

    @Override
    public int compareTo(IndexRow other) {
        int idCmp = this.courseId.compareTo(other.courseId);
        if (idCmp != 0) return idCmp;
        return this.word.compareTo(other.word);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexRow)) return false;
        IndexRow other = (IndexRow) o;
        return courseId.equals(other.courseId) && word.equals(other.word);
    }

    @Override
    public int hashCode() {
        return Objects.hash(courseId, word);
    }

    @Override
    public String toString() {
        return courseId + "|" + word;
    }
}
