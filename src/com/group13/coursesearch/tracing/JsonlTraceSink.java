package com.group13.coursesearch.tracing;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * A trace sink that appends events to a file in JSONL (JSON Lines) format.
 * Each event is written as a single-line JSON object; the errors field is omitted when null.
 */
public class JsonlTraceSink implements Consumer<TraceEvent> {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final String logFilePath;

    public JsonlTraceSink(String logFilePath) {
        this.logFilePath = logFilePath;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    @Override
    public synchronized void accept(TraceEvent event) {
        String json = GSON.toJson(event);

        // Append mode: one run log can collect several commands.
        try (PrintWriter out = new PrintWriter(new FileWriter(logFilePath, StandardCharsets.UTF_8, true))) {
            out.println(json);
        } catch (IOException e) {
            System.err.println("Trace sink " + logFilePath + " unavailable: " + e.getMessage());
        }
    }
}
