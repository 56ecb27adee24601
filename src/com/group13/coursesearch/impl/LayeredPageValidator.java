package com.group13.coursesearch.impl;

import com.group13.coursesearch.config.CrawlerConfig;
import com.group13.coursesearch.config.ResourceLoader;
import com.group13.coursesearch.core.Normalizer;
import com.group13.coursesearch.core.PageValidator;
import com.group13.coursesearch.model.CoursePage;
import com.group13.coursesearch.model.ValidationLayer;
import com.group13.coursesearch.model.ValidationResult;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Three-layer page validation. Each layer is a hard gate, evaluated in order:
 * <ol>
 *   <li>Syntactic: the URL matches the course-page pattern and is not a listing/admin path.</li>
 *   <li>Structural: title and description are present, the title is not a navigation label, and the
 *   page either mentions a course indicator or has a title with at least two words longer than
 *   four characters.</li>
 *   <li>Semantic: the normalized word set of title + description has at least {@code minWords} entries.</li>
 * </ol>
 */
public class LayeredPageValidator implements PageValidator {

    // Labels of filter widgets and menus that look like titles on listing pages
    private static final Set<String> NAVIGATION_LABELS = new HashSet<>(Arrays.asList(
        "TIPO", "MODALIDAD", "NIVEL", "CATEGORIA", "CATEGORÍA",
        "FILTRAR", "BUSCAR", "ORDENAR", "VER", "MOSTRAR"
    ));
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int SUBSTANTIAL_WORD_LENGTH = 4;
    private static final int MIN_SUBSTANTIAL_WORDS = 2;

    private final Pattern coursePattern;
    private final List<String> excludedPaths;
    private final int minTitleLength;
    private final int minWords;
    private final Normalizer normalizer;
    private final Set<String> courseIndicators;

    public LayeredPageValidator(CrawlerConfig config, Normalizer normalizer) {
        this(config, normalizer, ResourceLoader.courseIndicators());
    }

    public LayeredPageValidator(CrawlerConfig config, Normalizer normalizer, Set<String> courseIndicators) {
        this.coursePattern = config.getCoursePattern();
        this.excludedPaths = config.getExcludedPaths();
        this.minTitleLength = config.getMinTitleLength();
        this.minWords = config.getMinWords();
        this.normalizer = normalizer;
        this.courseIndicators = courseIndicators;
    }

    @Override
    public ValidationResult validate(CoursePage page) {
        // Layer 1: Syntactic
        String syntacticProblem = checkUrl(page.getUrl());
        if (syntacticProblem != null) {
            return ValidationResult.rejected(ValidationLayer.SYNTACTIC, syntacticProblem);
        }

        // Layer 2: Structural
        String structuralProblem = checkStructure(page.getTitle(), page.getDescription());
        if (structuralProblem != null) {
            return ValidationResult.rejected(ValidationLayer.STRUCTURAL, structuralProblem);
        }

        // Layer 3: Semantic
        Set<String> words = new LinkedHashSet<>(normalizer.normalize(page.indexableText()));
        if (words.size() < minWords) {
            return ValidationResult.rejected(ValidationLayer.SEMANTIC,
                    "only " + words.size() + " distinct words, " + minWords + " required");
        }
        return ValidationResult.accepted(words);
    }

    private String checkUrl(String url) {
        if (url == null || !coursePattern.matcher(url).matches()) {
            return "URL does not match the course pattern";
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (String excluded : excludedPaths) {
            if (lower.contains(excluded.toLowerCase(Locale.ROOT))) {
                return "URL is a listing or admin path (" + excluded + ")";
            }
        }
        return null;
    }

    private String checkStructure(String title, String description) {
        if (title == null || title.isBlank()) {
            return "missing title";
        }
        if (description == null || description.isBlank()) {
            return "missing description";
        }

        String titleClean = title.trim().toUpperCase(Locale.ROOT);
        if (NAVIGATION_LABELS.contains(titleClean)) {
            return "title is a navigation label";
        }
        if (DIGITS.matcher(titleClean).matches()) {
            return "title is numeric";
        }
        String[] titleWords = titleClean.split("\\s+");
        if (titleWords.length == 1 && titleWords[0].length() <= 3) {
            return "title is a single short word";
        }
        if (title.trim().length() < minTitleLength) {
            return "title shorter than " + minTitleLength + " characters";
        }
        if (!mentionsCourseIndicator(title, description) && substantialTitleWords(title) < MIN_SUBSTANTIAL_WORDS) {
            return "no course indicator and fewer than " + MIN_SUBSTANTIAL_WORDS + " substantial title words";
        }
        return null;
    }

    private boolean mentionsCourseIndicator(String title, String description) {
        String text = (title + " " + description).toLowerCase(Locale.ROOT);
        for (String indicator : courseIndicators) {
            if (text.contains(indicator)) {
                return true;
            }
        }
        return false;
    }

    private static int substantialTitleWords(String title) {
        int count = 0;
        for (String word : NON_WORD.split(title.trim())) {
            if (word.length() > SUBSTANTIAL_WORD_LENGTH) count++;
        }
        return count;
    }
}
