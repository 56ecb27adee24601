package com.group13.coursesearch.model;

import java.util.Collections;
import java.util.List;

/*
  Timing and quality figures for a single query.
  coverage = candidates / total courses; precisionAtK counts returned results
  whose score exceeds the relevance threshold.
 */
public class SearchPerformance {

    public static final double RELEVANCE_THRESHOLD = 0.1;

    private final String query;
    private final List<String> queryTokens;
    private final double preprocessingMillis;
    private final double candidateMillis;
    private final double scoringMillis;
    private final double totalMillis;
    private final int candidateCourses;
    private final int resultsFound;
    private final int resultsReturned;
    private final double coverage;
    private final double precisionAtK;
    private final double averageScore;

    public SearchPerformance(String query, List<String> queryTokens,
                             double preprocessingMillis, double candidateMillis,
                             double scoringMillis, double totalMillis,
                             int candidateCourses, int resultsFound, int resultsReturned,
                             double coverage, double precisionAtK, double averageScore) {
        this.query = query;
        this.queryTokens = Collections.unmodifiableList(queryTokens);
        this.preprocessingMillis = preprocessingMillis;
        this.candidateMillis = candidateMillis;
        this.scoringMillis = scoringMillis;
        this.totalMillis = totalMillis;
        this.candidateCourses = candidateCourses;
        this.resultsFound = resultsFound;
        this.resultsReturned = resultsReturned;
        this.coverage = coverage;
        this.precisionAtK = precisionAtK;
        this.averageScore = averageScore;
    }

    public String getQuery() { return query; }
    public List<String> getQueryTokens() { return queryTokens; }
    public double getPreprocessingMillis() { return preprocessingMillis; }
    public double getCandidateMillis() { return candidateMillis; }
    public double getScoringMillis() { return scoringMillis; }
    public double getTotalMillis() { return totalMillis; }
    public int getCandidateCourses() { return candidateCourses; }
    public int getResultsFound() { return resultsFound; }
    public int getResultsReturned() { return resultsReturned; }
    public double getCoverage() { return coverage; }
    public double getPrecisionAtK() { return precisionAtK; }
    public double getAverageScore() { return averageScore; }
}
