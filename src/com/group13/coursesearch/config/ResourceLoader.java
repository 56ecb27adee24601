package com.group13.coursesearch.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.group13.coursesearch.model.KeywordCategories;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Loads the bundled configuration resources from the classpath.
 * Stop words, course indicators and keyword categories are read once and cached as immutable structures.
 */
public final class ResourceLoader {

    public static final String CRAWLER_PROPERTIES = "crawler.properties";
    public static final String STOP_WORDS = "stopwords.txt";
    public static final String KEYWORD_CATEGORIES = "keyword-categories.json";
    public static final String COURSE_INDICATORS = "course-indicators.txt";

    private static volatile Set<String> stopWords;
    private static volatile Set<String> courseIndicators;
    private static volatile KeywordCategories keywordCategories;

    private ResourceLoader() {
    }

    public static Set<String> stopWords() {
        if (stopWords == null) {
            synchronized (ResourceLoader.class) {
                if (stopWords == null) {
                    stopWords = readWordList(STOP_WORDS);
                }
            }
        }
        return stopWords;
    }

    public static Set<String> courseIndicators() {
        if (courseIndicators == null) {
            synchronized (ResourceLoader.class) {
                if (courseIndicators == null) {
                    courseIndicators = readWordList(COURSE_INDICATORS);
                }
            }
        }
        return courseIndicators;
    }

    public static KeywordCategories keywordCategories() {
        if (keywordCategories == null) {
            synchronized (ResourceLoader.class) {
                if (keywordCategories == null) {
                    keywordCategories = readKeywordCategories(KEYWORD_CATEGORIES);
                }
            }
        }
        return keywordCategories;
    }

    public static Properties properties(String resource) {
        Properties properties = new Properties();
        try (Reader reader = open(resource)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
        return properties;
    }

    // One word per line; blank lines and '#' comments are ignored.
    static Set<String> readWordList(String resource) {
        Set<String> words = new LinkedHashSet<>();
        try (BufferedReader reader = new BufferedReader(open(resource))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.trim().toLowerCase(Locale.ROOT);
                if (!word.isEmpty() && !word.startsWith("#")) {
                    words.add(word);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
        return Collections.unmodifiableSet(words);
    }

    static KeywordCategories readKeywordCategories(String resource) {
        Type type = new TypeToken<LinkedHashMap<String, List<String>>>(){}.getType();
        try (Reader reader = open(resource)) {
            Map<String, List<String>> raw = new Gson().fromJson(reader, type);
            if (raw == null) {
                throw new IllegalStateException(resource + " is empty");
            }
            Map<String, Set<String>> categories = new LinkedHashMap<>();
            for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
                categories.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
            }
            return new KeywordCategories(categories);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        } catch (JsonParseException e) {
            throw new IllegalStateException("Malformed " + resource + ": " + e.getMessage(), e);
        }
    }

    private static Reader open(String resource) throws IOException {
        InputStream in = ResourceLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IOException("Resource not found on classpath: " + resource);
        }
        return new InputStreamReader(in, StandardCharsets.UTF_8);
    }
}
