package com.group13.coursesearch.model;

/*
  Size figures of a loaded corpus, shown before a search.
 */
public class SearchStatistics {

    private final int totalCourses;
    private final int vocabularySize;
    private final int indexEntries;
    private final double averageWordsPerCourse;

    public SearchStatistics(int totalCourses, int vocabularySize, int indexEntries, double averageWordsPerCourse) {
        this.totalCourses = totalCourses;
        this.vocabularySize = vocabularySize;
        this.indexEntries = indexEntries;
        this.averageWordsPerCourse = averageWordsPerCourse;
    }

    public int getTotalCourses() { return totalCourses; }
    public int getVocabularySize() { return vocabularySize; }
    public int getIndexEntries() { return indexEntries; }
    public double getAverageWordsPerCourse() { return averageWordsPerCourse; }

    @Override
    public String toString() {
        return String.format("courses=%d, vocabulary=%d, entries=%d, avgWords=%.1f",
                totalCourses, vocabularySize, indexEntries, averageWordsPerCourse);
    }
}
