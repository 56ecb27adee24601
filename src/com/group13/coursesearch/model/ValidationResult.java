package com.group13.coursesearch.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/*
  Outcome of validating one page.
  Accepted results carry the normalized word set; rejected ones name the failing layer.
 */
public class ValidationResult {

    private final boolean accepted;
    private final ValidationLayer failedLayer;
    private final String reason;
    private final Set<String> words;

    private ValidationResult(boolean accepted, ValidationLayer failedLayer, String reason, Set<String> words) {
        this.accepted = accepted;
        this.failedLayer = failedLayer;
        this.reason = reason;
        this.words = words;
    }

    public static ValidationResult accepted(Set<String> words) {
        return new ValidationResult(true, null, null, Collections.unmodifiableSet(new LinkedHashSet<>(words)));
    }

    public static ValidationResult rejected(ValidationLayer layer, String reason) {
        return new ValidationResult(false, layer, reason, Collections.emptySet());
    }

    public boolean isAccepted() { return accepted; }
    public ValidationLayer getFailedLayer() { return failedLayer; }
    public String getReason() { return reason; }
    public Set<String> getWords() { return words; }

    @Override
    public String toString() {
        return accepted ? "ACCEPTED (" + words.size() + " words)" : "REJECTED " + failedLayer + ": " + reason;
    }
}
