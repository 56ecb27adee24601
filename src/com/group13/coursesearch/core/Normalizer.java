package com.group13.coursesearch.core;

import java.util.List;

/**
 * Strategy Interface for text normalization.
 * Turns raw text (course title/description or a search query) into an ordered list of tokens.
 * The same implementation must be used at index time and at query time, otherwise exact
 * token matching between queries and courses breaks.
 */
public interface Normalizer {
    // Lowercases, strips accents and punctuation, splits and drops stop words.
    List<String> normalize(String text);
}
