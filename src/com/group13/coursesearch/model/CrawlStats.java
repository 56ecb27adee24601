package com.group13.coursesearch.model;

import java.util.EnumMap;
import java.util.Map;

/*
  Counters collected during one crawl run.
  Filled in by the crawler loop only; read by the caller once the run has ended.
 */
public class CrawlStats {

    private int fetchAttempts;
    private int pagesFetched;
    private int fetchFailures;
    private int coursesAccepted;
    private int linksEnqueued;
    private int duplicateCourses;
    private int processingFailures;
    private final Map<ValidationLayer, Integer> rejections = new EnumMap<>(ValidationLayer.class);
    private long startMillis;
    private long endMillis;

    public void markStart() { startMillis = System.currentTimeMillis(); }
    public void markEnd() { endMillis = System.currentTimeMillis(); }

    public void recordFetchAttempt() { fetchAttempts++; }
    public void recordPageFetched() { pagesFetched++; }
    public void recordFetchFailure() { fetchFailures++; }
    public void recordCourseAccepted() { coursesAccepted++; }
    public void recordLinksEnqueued(int count) { linksEnqueued += count; }
    public void recordDuplicateCourse() { duplicateCourses++; }
    public void recordProcessingFailure() { processingFailures++; }

    public void recordRejection(ValidationLayer layer) {
        rejections.merge(layer, 1, Integer::sum);
    }

    public int getFetchAttempts() { return fetchAttempts; }
    public int getPagesFetched() { return pagesFetched; }
    public int getFetchFailures() { return fetchFailures; }
    public int getCoursesAccepted() { return coursesAccepted; }
    public int getLinksEnqueued() { return linksEnqueued; }
    public int getDuplicateCourses() { return duplicateCourses; }
    public int getProcessingFailures() { return processingFailures; }

    public int getRejections(ValidationLayer layer) {
        return rejections.getOrDefault(layer, 0);
    }

    // Layer rejections plus duplicate ids and pages that failed to process.
    public int getTotalRejections() {
        int total = duplicateCourses + processingFailures;
        for (int count : rejections.values()) total += count;
        return total;
    }

    public long getElapsedMillis() {
        return Math.max(0, endMillis - startMillis);
    }

    @Override
    public String toString() {
        return "pages=" + pagesFetched + ", failures=" + fetchFailures + ", courses=" + coursesAccepted
                + ", rejected=" + rejections + ", duplicates=" + duplicateCourses
                + ", processingFailures=" + processingFailures + ", linksEnqueued=" + linksEnqueued
                + ", elapsedMs=" + getElapsedMillis();
    }
}
