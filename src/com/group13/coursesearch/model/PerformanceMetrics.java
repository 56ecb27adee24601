package com.group13.coursesearch.model;

/*
  Observational record emitted by the comparator for one similarity computation.
  Never feeds back into scoring.
 */
public class PerformanceMetrics {

    private final SimilarityMethod method;
    private final double similarityScore;
    private final int course1WordCount;
    private final int course2WordCount;
    private final int sharedWords;
    private final double vocabularyOverlap;  // shared / union of the two word sets
    private final long elapsedNanos;
    private final long memoryDeltaBytes;     // 0 when the probe cannot measure

    public PerformanceMetrics(SimilarityMethod method, double similarityScore,
                              int course1WordCount, int course2WordCount,
                              int sharedWords, double vocabularyOverlap,
                              long elapsedNanos, long memoryDeltaBytes) {
        this.method = method;
        this.similarityScore = similarityScore;
        this.course1WordCount = course1WordCount;
        this.course2WordCount = course2WordCount;
        this.sharedWords = sharedWords;
        this.vocabularyOverlap = vocabularyOverlap;
        this.elapsedNanos = elapsedNanos;
        this.memoryDeltaBytes = memoryDeltaBytes;
    }

    public SimilarityMethod getMethod() { return method; }
    public double getSimilarityScore() { return similarityScore; }
    public int getCourse1WordCount() { return course1WordCount; }
    public int getCourse2WordCount() { return course2WordCount; }
    public int getSharedWords() { return sharedWords; }
    public double getVocabularyOverlap() { return vocabularyOverlap; }
    public long getElapsedNanos() { return elapsedNanos; }
    public long getMemoryDeltaBytes() { return memoryDeltaBytes; }

    public double getElapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }

    public double getMemoryDeltaMb() {
        return memoryDeltaBytes / (1024.0 * 1024.0);
    }

    public String getComplexity() {
        return method.getComplexity();
    }

    @Override
    public String toString() {
        return String.format("%-10s similarity=%.4f time=%.3fms memory=%.2fMB words=%d/%d shared=%d overlap=%.2f%% %s",
                method.externalName(), similarityScore, getElapsedMillis(), getMemoryDeltaMb(),
                course1WordCount, course2WordCount, sharedWords, vocabularyOverlap * 100, getComplexity());
    }
}
