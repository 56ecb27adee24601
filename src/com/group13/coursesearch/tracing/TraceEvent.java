package com.group13.coursesearch.tracing;

/**
 * Represents a single trace event emitted by a crawl, search or comparison stage.
 * Serialized as {stage, inputs, outputsSummary, timingMs, errors, timestamp}.
 */
public class TraceEvent {
    public final String stage;           // Stage name (e.g., FETCH, CANDIDATES, COMPARE)
    public final String inputs;          // Input data given to the stage
    public final String outputsSummary;  // Summary of what the stage produced
    public final long timingMs;          // Execution time in milliseconds
    public final String errors;          // Failure description, null when the stage succeeded
    public final long timestamp;         // Creation time

    public TraceEvent(String stage, String inputs, String outputsSummary, long timingMs, String errors) {
        this.stage = stage;
        this.inputs = inputs != null ? inputs : "";
        this.outputsSummary = outputsSummary != null ? outputsSummary : "";
        this.timingMs = timingMs;
        this.errors = errors;
        this.timestamp = System.currentTimeMillis();
    }

    public boolean isError() {
        return errors != null && !errors.isEmpty();
    }
}
