package com.group13.coursesearch.impl;

import com.group13.coursesearch.config.ResourceLoader;
import com.group13.coursesearch.core.Normalizer;

import java.text.Normalizer.Form;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Implementation of the Normalization Strategy.
 * Used on course text at crawl time and on queries at search time.
 */
public class TextNormalizer implements Normalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{Nd}\\-]+");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+");

    public static final int DEFAULT_MIN_TOKEN_LENGTH = 2;

    private final Set<String> stopWords;
    private final int minTokenLength;

    public TextNormalizer(Set<String> stopWords) {
        this(stopWords, DEFAULT_MIN_TOKEN_LENGTH);
    }

    public TextNormalizer(Set<String> stopWords, int minTokenLength) {
        this.stopWords = Collections.unmodifiableSet(stopWords);
        this.minTokenLength = Math.max(1, minTokenLength);
    }

    // Normalizer backed by the bundled stop-word list.
    public static TextNormalizer withDefaultStopWords() {
        return new TextNormalizer(ResourceLoader.stopWords());
    }

    @Override
    public List<String> normalize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }

        // 1. Case folding and accent stripping ("Gestión" -> "gestion", "diseño" -> "diseno")
        String folded = java.text.Normalizer.normalize(text.toLowerCase(Locale.ROOT), Form.NFD);
        folded = COMBINING_MARKS.matcher(folded).replaceAll("");

        // 2. Everything except letters, digits and hyphens becomes a separator
        folded = DISALLOWED.matcher(folded).replaceAll(" ");

        // 3. Tokenization on whitespace and hyphens, then filtering
        for (String token : SEPARATORS.split(folded)) {
            if (token.length() < minTokenLength) continue;
            if (stopWords.contains(token)) continue;
            tokens.add(token);
        }
        return tokens;
    }

    public Set<String> getStopWords() {
        return stopWords;
    }
}
