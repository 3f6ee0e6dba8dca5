package io.tabula.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabula.core.event.AgentEvent;
import io.tabula.core.event.EventSink;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

final class ConsoleEventPrinter implements EventSink {
    private final PrintStream out;
    private final PrintStream err;
    private final boolean json;
    private final ObjectMapper mapper = new ObjectMapper();

    ConsoleEventPrinter(PrintStream out, PrintStream err, boolean json) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
        this.json = json;
    }

    @Override
    public synchronized void emit(AgentEvent event) {
        if (json) {
            try {
                out.println(mapper.writeValueAsString(event.toWire()));
            } catch (JsonProcessingException e) {
                err.println("Failed to encode event " + event.type().wireName() + ": " + e.getOriginalMessage());
            }
            return;
        }

        Map<String, Object> data = event.data();
        switch (event.type()) {
            case STATUS -> err.println("... " + data.get("message"));
            case TEXT -> out.println(data.get("text"));
            case TABLE -> printTable(data);
            case PLOT -> out.println("[plot] " + data.getOrDefault("title", ""));
            case QUERY_RESULT -> printQuery(data);
            case ERROR -> err.println("Error: " + data.get("message"));
            case SESSION_UPDATE -> err.println("Session title: " + data.get("session_title"));
            case DONE -> err.println("Done (" + data.get("finish_reason") + ", " + data.get("iterations") + " iterations)");
            default -> {
                // text deltas and judge events have no readable form
            }
        }
    }

    private void printQuery(Map<String, Object> data) {
        String label = String.valueOf(data.getOrDefault("description", ""));
        if (label.isBlank()) {
            label = String.valueOf(data.getOrDefault("query", ""));
        }
        if (Boolean.TRUE.equals(data.get("success"))) {
            err.println("[query] " + label + " -> " + data.get("kind") + ", " + data.get("row_count") + " rows");
        } else {
            err.println("[query] " + label + " failed: " + data.get("error"));
        }
    }

    private void printTable(Map<String, Object> data) {
        Object title = data.get("title");
        if (title != null && !String.valueOf(title).isBlank()) {
            out.println(title);
        }
        out.println(join(data.get("headers")));
        Object rows = data.get("rows");
        if (rows instanceof List<?> list) {
            for (Object row : list) {
                out.println(join(row));
            }
        }
        if (Boolean.TRUE.equals(data.get("truncated"))) {
            out.println("(" + data.get("total_rows") + " rows in total)");
        }
    }

    private static String join(Object cells) {
        if (!(cells instanceof List<?> list)) {
            return "";
        }
        return list.stream()
            .map(cell -> cell == null ? "" : String.valueOf(cell))
            .collect(Collectors.joining(" | "));
    }
}
