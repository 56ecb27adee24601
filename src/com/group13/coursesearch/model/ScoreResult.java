package com.group13.coursesearch.model;

/*
  Represents one ranked search result (a "hit") produced by a Ranker.
  Implements Comparable to support deterministic sorting.
  The coverage / cosine breakdown is only filled in by the hybrid ranking.
 */
public class ScoreResult implements Comparable<ScoreResult> {

    private final String courseId;
    private final String url;
    private final String title;
    private final double score;     // Method dependent range
    private final Double coverage;  // Fraction of distinct query tokens matched (hybrid only)
    private final Double cosine;    // Cosine component (hybrid only)

    public ScoreResult(CourseRecord course, double score) {
        this(course, score, null, null);
    }

    public ScoreResult(CourseRecord course, double score, Double coverage, Double cosine) {
        this.courseId = course.getCourseId();
        this.url = course.getUrl();
        this.title = course.getTitle();
        this.score = score;
        this.coverage = coverage;
        this.cosine = cosine;
    }

    public String getCourseId() { return courseId; }
    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public double getScore() { return score; }
    public Double getCoverage() { return coverage; }
    public Double getCosine() { return cosine; }

    public boolean hasBreakdown() {
        return coverage != null && cosine != null;
    }

    /*
      Sorting Order:
      1. Score DESC
      2. Title ASC (tie-break)
      3. CourseId ASC (ids are unique, so the order is total)
     */
    @Override
    public int compareTo(ScoreResult other) {
        int scoreCmp = Double.compare(other.score, this.score);
        if (scoreCmp != 0) return scoreCmp;

        int titleCmp = this.title.compareTo(other.title);
        if (titleCmp != 0) return titleCmp;

        return this.courseId.compareTo(other.courseId);
    }

    @Override
    public String toString() {
        String base = String.format("%s %.4f %s", courseId, score, url);
        if (hasBreakdown()) {
            base += String.format(" (coverage=%.2f, cosine=%.4f)", coverage, cosine);
        }
        return base;
    }
}
