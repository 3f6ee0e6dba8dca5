package io.tabula.core.agent;

import io.tabula.core.evaluation.CheckResult;
import io.tabula.core.evaluation.EvaluationReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class TurnState {
    private final String userMessage;
    private final List<String> previews = new ArrayList<>();
    private final List<String> texts = new ArrayList<>();
    private final List<String> plotTitles = new ArrayList<>();
    private final List<CheckResult> metrics = new ArrayList<>();
    private int iteration;
    private RunPhase phase = RunPhase.PLANNING;
    private int textCount;
    private int plotCount;
    private int datasetVersion;
    private boolean dataUpdated;
    private boolean finished;
    private String sessionTitle;
    private List<String> suggestions = List.of();

    public TurnState(String userMessage, int datasetVersion) {
        this.userMessage = userMessage == null ? "" : userMessage;
        this.datasetVersion = datasetVersion;
    }

    public String userMessage() {
        return userMessage;
    }

    public synchronized int nextIteration() {
        return ++iteration;
    }

    public synchronized int iteration() {
        return iteration;
    }

    public synchronized RunPhase phase() {
        return phase;
    }

    public synchronized void phase(RunPhase phase) {
        this.phase = phase;
    }

    public synchronized void recordText(String text) {
        textCount++;
        texts.add(text == null ? "" : text);
    }

    public synchronized void recordPlot(String title) {
        plotCount++;
        plotTitles.add(title == null || title.isBlank() ? "untitled" : title);
    }

    public synchronized int textCount() {
        return textCount;
    }

    public synchronized int plotCount() {
        return plotCount;
    }

    public synchronized List<String> texts() {
        return List.copyOf(texts);
    }

    public synchronized List<String> plotTitles() {
        return List.copyOf(plotTitles);
    }

    public synchronized void addPreview(String preview) {
        if (preview != null && !preview.isBlank()) {
            previews.add(preview);
        }
    }

    public synchronized List<String> previews() {
        return List.copyOf(previews);
    }

    public synchronized void addChecks(EvaluationReport report) {
        metrics.addAll(report.checks());
    }

    public synchronized List<CheckResult> metrics() {
        return List.copyOf(metrics);
    }

    public synchronized List<Map<String, Object>> metricMaps() {
        return metrics.stream().map(CheckResult::toMap).toList();
    }

    public synchronized void markDataUpdated(int version) {
        dataUpdated = true;
        datasetVersion = Math.max(datasetVersion, version);
    }

    public synchronized boolean dataUpdated() {
        return dataUpdated;
    }

    public synchronized int datasetVersion() {
        return datasetVersion;
    }

    public synchronized void finish(String sessionTitle, List<String> suggestions) {
        finished = true;
        if (sessionTitle != null && !sessionTitle.isBlank()) {
            this.sessionTitle = sessionTitle.strip();
        }
        if (suggestions != null) {
            this.suggestions = List.copyOf(suggestions);
        }
    }

    public synchronized boolean finished() {
        return finished;
    }

    public synchronized String sessionTitle() {
        return sessionTitle;
    }

    public synchronized List<String> suggestions() {
        return suggestions;
    }
}
