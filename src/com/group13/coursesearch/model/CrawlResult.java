package com.group13.coursesearch.model;

import java.util.Collections;
import java.util.List;

/*
  Everything a crawl run emits: the course dictionary, the flat (course_id, word)
  relation without duplicate pairs, the run counters and the terminal state reached.
 */
public class CrawlResult {

    public enum Termination {
        // The frontier ran out of URLs.
        FRONTIER_EXHAUSTED,
        // The configured number of successfully fetched pages was reached.
        PAGE_BUDGET_REACHED
    }

    private final CourseDictionary dictionary;
    private final List<IndexRow> rows;
    private final CrawlStats stats;
    private final Termination termination;

    public CrawlResult(CourseDictionary dictionary, List<IndexRow> rows, CrawlStats stats, Termination termination) {
        this.dictionary = dictionary;
        this.rows = Collections.unmodifiableList(rows);
        this.stats = stats;
        this.termination = termination;
    }

    public CourseDictionary getDictionary() { return dictionary; }
    public List<IndexRow> getRows() { return rows; }
    public CrawlStats getStats() { return stats; }
    public Termination getTermination() { return termination; }
}
