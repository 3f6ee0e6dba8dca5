package io.tabula.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ObservabilityService {
    private static final Logger LOG = LoggerFactory.getLogger(ObservabilityService.class);
    private static final int MAX_EVENTS = 20_000;

    private final AuditStore store;
    private final Clock clock;

    public ObservabilityService(AuditStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized AuditEvent record(String type, Map<String, Object> attributes) throws IOException {
        List<AuditEvent> all = new ArrayList<>(store.load());
        AuditEvent event = new AuditEvent(
            UUID.randomUUID().toString(),
            clock.instant(),
            type,
            attributes
        );
        all.add(event);
        if (all.size() > MAX_EVENTS) {
            all = new ArrayList<>(all.subList(all.size() - MAX_EVENTS, all.size()));
        }
        store.save(all);
        return event;
    }

    /**
     * Records an event from inside a run, where an audit failure must not surface.
     */
    public void recordQuietly(String type, Map<String, Object> attributes) {
        try {
            record(type, attributes);
        } catch (IOException e) {
            LOG.debug("Failed to record {} audit event: {}", type, e.getMessage());
        }
    }

    public synchronized List<AuditEvent> recent(int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .sorted(Comparator.comparing(AuditEvent::timestamp).reversed())
            .limit(safe)
            .toList();
    }

    public synchronized RuntimeSummary summary() throws IOException {
        List<AuditEvent> all = store.load();

        int runsStarted = byType(all, AuditEventTypes.RUN_STARTED).size();
        int runsCompleted = byType(all, AuditEventTypes.RUN_COMPLETED).size();
        int runsFailed = byType(all, AuditEventTypes.RUN_FAILED).size();

        List<AuditEvent> toolSucceeded = byType(all, AuditEventTypes.TOOL_SUCCEEDED);
        List<AuditEvent> toolFailed = byType(all, AuditEventTypes.TOOL_FAILED);
        int toolCalls = toolSucceeded.size() + toolFailed.size();

        long queriesOk = toolSucceeded.stream().filter(this::isQuery).count();
        long queriesFailed = toolFailed.stream().filter(this::isQuery).count();
        double querySuccessRate = percentage(queriesOk, queriesOk + queriesFailed);

        List<Double> latencies = new ArrayList<>();
        for (AuditEvent event : toolSucceeded) {
            addLatency(latencies, event);
        }
        for (AuditEvent event : toolFailed) {
            addLatency(latencies, event);
        }
        latencies.sort(Comparator.naturalOrder());

        List<AuditEvent> grounding = byType(all, AuditEventTypes.GROUNDING_CHECKED);
        long groundingPassed = grounding.stream()
            .filter(event -> Boolean.parseBoolean(str(event.attributes().get("passed"))))
            .count();

        return new RuntimeSummary(
            runsStarted,
            runsCompleted,
            runsFailed,
            toolCalls,
            toolFailed.size(),
            round2(querySuccessRate),
            round2(percentile(latencies, 50)),
            round2(percentile(latencies, 95)),
            byType(all, AuditEventTypes.QUERY_BLOCKED).size(),
            grounding.size(),
            round2(percentage(groundingPassed, grounding.size())),
            all.size()
        );
    }

    private List<AuditEvent> byType(List<AuditEvent> events, String type) {
        return events.stream().filter(e -> type.equalsIgnoreCase(e.type())).toList();
    }

    private boolean isQuery(AuditEvent event) {
        return "query".equals(str(event.attributes().get("tool_name")));
    }

    private void addLatency(List<Double> latencies, AuditEvent event) {
        Double value = toDouble(event.attributes().get("duration_ms"));
        if (value != null && value >= 0) {
            latencies.add(value);
        }
    }

    private String str(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }

    private Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int safe = Math.max(0, Math.min(100, percentile));
        int index = (int) Math.ceil((safe / 100.0) * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    private double percentage(long numerator, long denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return (numerator * 100.0) / denominator;
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
