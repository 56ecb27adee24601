package com.group13.coursesearch.tests;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.group13.coursesearch.impl.InvertedIndexBuilder;
import com.group13.coursesearch.impl.TextNormalizer;
import com.group13.coursesearch.model.CourseDictionary;
import com.group13.coursesearch.model.SearchMethod;
import com.group13.coursesearch.pipeline.CourseSearchEngine;
import com.group13.coursesearch.tracing.JsonlTraceSink;
import com.group13.coursesearch.tracing.TraceBus;
import com.group13.coursesearch.tracing.TraceEvent;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Pipeline stages report to the trace bus; the JSONL sink writes one object per line.
 */
class TraceSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void testSearchStagesAreTraced() {
        CourseDictionary dictionary = TestCourses.dictionary(
                TestCourses.course("python-datos", "Python para Datos", "python", "datos"),
                TestCourses.course("cocina-casera", "Cocina Casera", "cocina", "recetas"));
        CourseSearchEngine engine = new CourseSearchEngine(dictionary, InvertedIndexBuilder.build(dictionary),
                TextNormalizer.withDefaultStopWords());

        List<String> stages = new ArrayList<>();
        Consumer<TraceEvent> listener = e -> stages.add(e.stage);
        TraceBus.register(listener);
        try {
            engine.search("python", SearchMethod.SMART, 5);
        } finally {
            TraceBus.unregister(listener);
        }

        assertTrue(stages.contains("QUERY"), "Query stage must be traced");
        assertTrue(stages.contains("CANDIDATES"), "Candidate stage must be traced");
        assertTrue(stages.contains("RANK"), "Rank stage must be traced");
    }

    @Test
    void testJsonlSink() throws IOException {
        Path log = tempDir.resolve("trace.jsonl");
        JsonlTraceSink sink = new JsonlTraceSink(log.toString());
        TraceBus.register(sink);
        try {
            TraceBus.push("ACCEPT", "gestion-proyectos-agiles (8 words)");
            TraceBus.push("QUERY", "Gestión de Proyectos Ágiles");
            TraceBus.error("FETCH_FAILED", "https://example.edu/pagina-rota", "HTTP 404");
        } finally {
            TraceBus.unregister(sink);
        }

        List<String> lines = Files.readAllLines(log, StandardCharsets.UTF_8);
        assertEquals(3, lines.size(), "One line per event");

        JsonObject accepted = JsonParser.parseString(lines.get(0)).getAsJsonObject();
        assertEquals("ACCEPT", accepted.get("stage").getAsString());
        assertEquals("gestion-proyectos-agiles (8 words)", accepted.get("outputsSummary").getAsString());
        assertFalse(accepted.has("errors"), "Null errors are omitted");

        JsonObject accented = JsonParser.parseString(lines.get(1)).getAsJsonObject();
        assertEquals("Gestión de Proyectos Ágiles", accented.get("outputsSummary").getAsString(),
                "Accented text is written as UTF-8 whatever the platform charset");

        JsonObject failed = JsonParser.parseString(lines.get(2)).getAsJsonObject();
        assertEquals("HTTP 404", failed.get("errors").getAsString());
        assertEquals("https://example.edu/pagina-rota", failed.get("inputs").getAsString());
    }
}
