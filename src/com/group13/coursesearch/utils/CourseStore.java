package com.group13.coursesearch.utils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.group13.coursesearch.impl.InvertedIndexBuilder;
import com.group13.coursesearch.model.CourseDictionary;
import com.group13.coursesearch.model.CourseRecord;
import com.group13.coursesearch.model.IndexRow;
import com.group13.coursesearch.model.InvertedIndex;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the crawl output files.
 * <ul>
 *   <li>Dictionary: JSON object {@code course_id -> {url, title, description, words}}.</li>
 *   <li>Index: one {@code course_id|word} line per unique pair, no header.</li>
 * </ul>
 */
public final class CourseStore {

    public static final String DEFAULT_DICTIONARY_FILE = "curso.json";
    public static final String DEFAULT_INDEX_FILE = "curso.csv";

    private static final char SEPARATOR = '|';
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private static final Type DICTIONARY_TYPE = new TypeToken<LinkedHashMap<String, StoredCourse>>() {}.getType();

    private CourseStore() {
    }

    // JSON shape of one course entry.
    private static class StoredCourse {
        String url;
        String title;
        String description;
        List<String> words;
    }

    public static void saveDictionary(CourseDictionary dictionary, Path file) throws IOException {
        Map<String, StoredCourse> out = new LinkedHashMap<>();
        for (CourseRecord record : dictionary.records()) {
            StoredCourse stored = new StoredCourse();
            stored.url = record.getUrl();
            stored.title = record.getTitle();
            stored.description = record.getDescription();
            stored.words = new ArrayList<>(record.getWords());
            out.put(record.getCourseId(), stored);
        }
        createParent(file);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(out, DICTIONARY_TYPE, writer);
        }
    }

    /**
     * Loads a dictionary file written by {@link #saveDictionary}.
     *
     * @throws IOException if the file cannot be read or is not a valid dictionary
     */
    public static CourseDictionary loadDictionary(Path file) throws IOException {
        Map<String, StoredCourse> stored;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            stored = GSON.fromJson(reader, DICTIONARY_TYPE);
        } catch (JsonParseException e) {
            throw new IOException("Invalid dictionary file " + file + ": " + e.getMessage(), e);
        }
        if (stored == null) {
            throw new IOException("Empty dictionary file " + file);
        }

        Map<String, CourseRecord> courses = new LinkedHashMap<>();
        for (Map.Entry<String, StoredCourse> entry : stored.entrySet()) {
            StoredCourse course = entry.getValue();
            if (course == null || course.url == null || course.words == null || course.words.isEmpty()) {
                throw new IOException("Malformed course entry '" + entry.getKey() + "' in " + file);
            }
            courses.put(entry.getKey(), new CourseRecord(entry.getKey(), course.url,
                    course.title != null ? course.title : "",
                    course.description != null ? course.description : "",
                    new LinkedHashSet<>(course.words)));
        }
        return new CourseDictionary(courses);
    }

    public static void saveIndexRows(List<IndexRow> rows, Path file) throws IOException {
        createParent(file);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (IndexRow row : new LinkedHashSet<>(rows)) {
                writer.write(row.getCourseId() + SEPARATOR + row.getWord());
                writer.write(System.lineSeparator());
            }
        }
    }

    /**
     * Reads index rows; blank lines are skipped.
     *
     * @throws IOException if a line is not of the form {@code course_id|word}
     */
    public static List<IndexRow> loadIndexRows(Path file) throws IOException {
        List<IndexRow> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) continue;

                int split = line.indexOf(SEPARATOR);
                if (split <= 0 || split == line.length() - 1 || line.indexOf(SEPARATOR, split + 1) >= 0) {
                    throw new IOException("Malformed index row at " + file + ":" + lineNumber + ": " + line);
                }
                rows.add(new IndexRow(line.substring(0, split).trim(), line.substring(split + 1).trim()));
            }
        }
        return rows;
    }

    /**
     * Loads the index file and checks every row against the dictionary.
     *
     * @throws com.group13.coursesearch.model.UnknownCourseException if a row names an unknown course
     */
    public static InvertedIndex loadIndex(Path file, CourseDictionary dictionary) throws IOException {
        return InvertedIndexBuilder.fromRows(loadIndexRows(file), dictionary);
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
