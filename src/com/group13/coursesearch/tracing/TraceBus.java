package com.group13.coursesearch.tracing;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * A simple event bus implementing the Observer pattern for tracing.
 * Producers (crawler, search engine, comparator) push events; registered sinks consume them.
 * Registration and notification are safe from concurrent searches.
 */
public final class TraceBus {

    private static final List<Consumer<TraceEvent>> listeners = new CopyOnWriteArrayList<>();

    private TraceBus() {
    }

    public static void register(Consumer<TraceEvent> listener) {
        listeners.add(listener);
    }

    public static void unregister(Consumer<TraceEvent> listener) {
        listeners.remove(listener);
    }

    // Short form: the message becomes the outputs summary.
    public static void push(String stage, String message) {
        pushFull(stage, "", message, 0, null);
    }

    public static void error(String stage, String inputs, String errors) {
        pushFull(stage, inputs, "", 0, errors);
    }

    /**
     * Pushes a complete trace event to every registered sink.
     *
     * @param stage          the stage name
     * @param inputs         input data of the stage
     * @param outputsSummary summary of the stage output
     * @param timingMs       execution time in milliseconds
     * @param errors         error message, null on success
     */
    public static void pushFull(String stage, String inputs, String outputsSummary, long timingMs, String errors) {
        if (listeners.isEmpty()) {
            return;
        }
        TraceEvent event = new TraceEvent(stage, inputs, outputsSummary, timingMs, errors);
        for (Consumer<TraceEvent> listener : listeners) {
            listener.accept(event);
        }
    }
}
