package io.tabula.core.agent;

import io.tabula.core.dataset.DatasetHandle;
import io.tabula.core.evaluation.JudgeVerdict;
import io.tabula.core.evaluation.LlmJudge;
import io.tabula.core.event.AgentEvent;
import io.tabula.core.event.EventSink;
import io.tabula.core.event.EventType;
import io.tabula.core.model.ChatMessage;
import io.tabula.core.model.MessageRole;
import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolResult;
import io.tabula.core.observability.AuditEventTypes;
import io.tabula.core.observability.ObservabilityService;
import io.tabula.core.provider.LlmProvider;
import io.tabula.core.provider.LlmProviderException;
import io.tabula.core.provider.LlmRequest;
import io.tabula.core.provider.LlmResponse;
import io.tabula.core.provider.LlmStreamListener;
import io.tabula.core.session.MessageTypes;
import io.tabula.core.session.PersistenceHook;
import io.tabula.core.stream.ToolInputTextExtractor;
import io.tabula.core.tool.ToolContext;
import io.tabula.core.tool.ToolDispatcher;
import io.tabula.core.tool.ToolName;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one conversational turn: LLM call, tool batch, results back into the conversation, until
 * the model finalizes, stops calling tools, fails, or hits the iteration ceiling.
 *
 * <p>Every run ends with exactly one {@code done} event; anything offered to the sink afterwards is
 * dropped. If the run produced no text and no plot, a fallback text precedes {@code done}.
 */
public final class TurnOrchestrator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TurnOrchestrator.class);
    static final String FALLBACK_TEXT = "I wasn't able to produce an answer for this request. "
        + "Please try rephrasing the question or asking for something more specific.";
    private static final Duration CLOSE_GRACE = Duration.ofSeconds(2);

    private final LlmProvider provider;
    private final ToolDispatcher dispatcher;
    private final AgentSettings settings;
    private final SystemPromptBuilder promptBuilder;
    private final LlmJudge turnJudge;
    private final ObservabilityService observability;
    private final ExecutorService runExecutor;
    private final ExecutorService toolExecutor;

    public TurnOrchestrator(LlmProvider provider, ToolDispatcher dispatcher, AgentSettings settings) {
        this(provider, dispatcher, settings, null, null);
    }

    /**
     * @param turnJudge optional judge grading the whole turn at its end
     * @param observability optional audit trail
     */
    public TurnOrchestrator(
        LlmProvider provider,
        ToolDispatcher dispatcher,
        AgentSettings settings,
        LlmJudge turnJudge,
        ObservabilityService observability
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.settings = settings == null ? AgentSettings.defaults() : settings;
        this.promptBuilder = new SystemPromptBuilder(this.settings.tableName());
        this.turnJudge = turnJudge;
        this.observability = observability;
        this.runExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("tabula-run-"));
        this.toolExecutor = Executors.newFixedThreadPool(4, new NamedThreadFactory("tabula-tool-"));
    }

    public RunHandle start(String userMessage, DatasetHandle dataset, TurnContext context, EventSink sink) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        Run run = new Run(
            userMessage == null ? "" : userMessage,
            dataset,
            context == null ? TurnContext.fresh() : context,
            new RunEmitter(sink)
        );
        Future<?> task = runExecutor.submit(run::execute);
        return new RunHandle(run, task);
    }

    /**
     * Blocking form of {@link #start}.
     */
    public RunSummary run(String userMessage, DatasetHandle dataset, TurnContext context, EventSink sink)
        throws InterruptedException {
        return start(userMessage, dataset, context, sink).await();
    }

    /**
     * Lets finished runs write their trailing audit records, then interrupts whatever is left.
     */
    @Override
    public void close() {
        runExecutor.shutdown();
        toolExecutor.shutdown();
        try {
            if (!runExecutor.awaitTermination(CLOSE_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.debug("Runs still active after {}ms, interrupting", CLOSE_GRACE.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            runExecutor.shutdownNow();
            toolExecutor.shutdownNow();
        }
    }

    /**
     * State of one run. {@link #terminate} is the only path to {@code done}.
     */
    final class Run {
        private final String runId = UUID.randomUUID().toString();
        private final String userMessage;
        private final DatasetHandle dataset;
        private final TurnContext context;
        private final RunEmitter emitter;
        private final TurnState state;
        private final AtomicBoolean terminated = new AtomicBoolean();
        private final CompletableFuture<RunSummary> outcome = new CompletableFuture<>();
        private final long startedAtMillis = System.currentTimeMillis();

        private Run(String userMessage, DatasetHandle dataset, TurnContext context, RunEmitter emitter) {
            this.userMessage = userMessage;
            this.dataset = dataset;
            this.context = context;
            this.emitter = emitter;
            this.state = new TurnState(userMessage, dataset.current().version());
        }

        TurnState state() {
            return state;
        }

        CompletableFuture<RunSummary> outcome() {
            return outcome;
        }

        void execute() {
            LOG.info("Run {} started", runId);
            audit(AuditEventTypes.RUN_STARTED, Map.of("run_id", runId));
            try {
                loop();
            } catch (RuntimeException e) {
                LOG.error("Run {} failed unexpectedly", runId, e);
                emitter.emit(AgentEvent.error("Internal error: " + e.getMessage()));
                state.phase(RunPhase.ERROR);
                terminate(FinishReason.ERROR);
            } finally {
                // no path may leave the caller without done
                if (!terminated.get()) {
                    terminate(Thread.currentThread().isInterrupted() ? FinishReason.CANCELLED : FinishReason.ERROR);
                }
            }
        }

        private void loop() {
            List<ChatMessage> messages = new ArrayList<>(context.history());
            if (!userMessage.isBlank()) {
                messages.add(ChatMessage.user(userMessage));
                persist(MessageRole.USER, userMessage, MessageTypes.TEXT, Map.of());
            } else if (messages.isEmpty()) {
                messages.add(ChatMessage.user("Analyze the dataset."));
            }
            ToolContext toolContext = new ToolContext(state, dataset, emitter, context.persistence());

            while (!stopped()) {
                if (state.iteration() >= settings.maxIterations()) {
                    LOG.info("Run {} reached the iteration ceiling of {}", runId, settings.maxIterations());
                    judgeTurn();
                    terminate(FinishReason.ITERATION_LIMIT);
                    return;
                }
                int iteration = state.nextIteration();
                state.phase(RunPhase.PLANNING);
                emitter.emit(AgentEvent.status(iteration == 1 ? "Thinking..." : "Analyzing results..."));

                LlmResponse response;
                try {
                    LlmRequest request = new LlmRequest(
                        settings.model(),
                        promptBuilder.build(dataset.current(), context.initialAnalysis()),
                        messages,
                        dispatcher.registry().definitions(),
                        settings.maxTokens()
                    );
                    response = provider.complete(request, new TextDeltaForwarder(emitter));
                } catch (LlmProviderException e) {
                    if (terminated.get()) {
                        return;
                    }
                    LOG.error("Run {} LLM call failed: {}", runId, e.getMessage());
                    state.phase(RunPhase.ERROR);
                    emitter.emit(AgentEvent.error("LLM call failed: " + e.getMessage()));
                    terminate(FinishReason.ERROR);
                    return;
                }
                if (stopped()) {
                    // providers that ignore the interrupt still return once the call completes
                    LOG.debug("Run {} stopped during the LLM call, discarding the response", runId);
                    return;
                }

                List<ToolInvocation> invocations = response.toolInvocations();
                String text = response.text();
                if (invocations.isEmpty()) {
                    if (!text.isBlank()) {
                        emitter.emit(AgentEvent.text(text));
                        state.recordText(text);
                        persist(MessageRole.ASSISTANT, text, MessageTypes.TEXT, Map.of());
                    }
                    judgeTurn();
                    terminate(FinishReason.END_TURN);
                    return;
                }

                messages.add(ChatMessage.assistant(response.content()));
                if (!text.isBlank()) {
                    persist(MessageRole.ASSISTANT, text, MessageTypes.REASONING, Map.of());
                }
                state.phase(RunPhase.EXECUTING);
                LOG.debug("Run {} iteration {} executing {} tool call(s)", runId, iteration, invocations.size());
                List<ToolResult> results = executeBatch(invocations, toolContext);
                if (stopped()) {
                    return;
                }
                messages.add(ChatMessage.toolResults(results));

                if (state.finished()) {
                    state.phase(RunPhase.FINALIZING);
                    judgeTurn();
                    terminate(FinishReason.FINALIZE);
                    return;
                }
            }
        }

        private List<ToolResult> executeBatch(List<ToolInvocation> invocations, ToolContext toolContext) {
            List<ToolResult> results = new ArrayList<>(invocations.size());
            int i = 0;
            while (i < invocations.size() && !stopped()) {
                if (!isQuery(invocations.get(i))) {
                    results.add(dispatcher.dispatch(invocations.get(i), toolContext));
                    i++;
                    continue;
                }
                int end = i;
                while (end < invocations.size() && isQuery(invocations.get(end))) {
                    end++;
                }
                List<ToolInvocation> segment = invocations.subList(i, end);
                if (settings.parallelQueries() && segment.size() > 1) {
                    results.addAll(executeParallel(segment, toolContext.pinned(dataset.current())));
                } else {
                    for (ToolInvocation invocation : segment) {
                        if (stopped()) {
                            break;
                        }
                        results.add(dispatcher.dispatch(invocation, toolContext));
                    }
                }
                i = end;
            }
            return results;
        }

        private List<ToolResult> executeParallel(List<ToolInvocation> segment, ToolContext pinned) {
            List<Future<ToolResult>> futures = new ArrayList<>(segment.size());
            for (ToolInvocation invocation : segment) {
                futures.add(toolExecutor.submit(() -> stopped()
                    ? ToolResult.failure(invocation, "Query cancelled")
                    : dispatcher.dispatch(invocation, pinned)));
            }
            List<ToolResult> results = new ArrayList<>(segment.size());
            for (int i = 0; i < segment.size(); i++) {
                ToolInvocation invocation = segment.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    futures.forEach(future -> future.cancel(true));
                    results.add(ToolResult.failure(invocation, "Query cancelled"));
                } catch (ExecutionException e) {
                    LOG.warn("Parallel query {} failed", invocation.id(), e.getCause());
                    results.add(ToolResult.failure(invocation, "Error executing tool 'query': " + e.getCause().getMessage()));
                }
            }
            return results;
        }

        private boolean stopped() {
            return terminated.get() || Thread.currentThread().isInterrupted();
        }

        private boolean isQuery(ToolInvocation invocation) {
            return ToolName.QUERY.wireName().equals(invocation.name());
        }

        private void judgeTurn() {
            if (turnJudge == null || state.textCount() == 0) {
                return;
            }
            JudgeVerdict verdict = turnJudge.evaluateTurn(userMessage, state.texts(), state.previews(), state.plotTitles());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("source", "turn_judge");
            data.put("verdict", verdict.toMap());
            emitter.emit(AgentEvent.of(EventType.JUDGE, data));
        }

        /**
         * Emits the fallback text if needed, then {@code done}. Only the first call has any effect.
         */
        boolean terminate(FinishReason reason) {
            if (!terminated.compareAndSet(false, true)) {
                return false;
            }
            if (!emitter.producedVisibleOutput()) {
                emitter.emit(AgentEvent.text(FALLBACK_TEXT));
                persist(MessageRole.ASSISTANT, FALLBACK_TEXT, MessageTypes.TEXT, Map.of());
            }
            if (reason != FinishReason.ERROR) {
                state.phase(RunPhase.DONE);
            }
            RunSummary summary = RunSummary.of(reason, state);
            emitter.emit(AgentEvent.of(EventType.DONE, summary.toDoneData()));
            outcome.complete(summary);

            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put("run_id", runId);
            attrs.put("finish_reason", reason.wireName());
            attrs.put("iterations", summary.iterations());
            attrs.put("duration_ms", Math.max(0, System.currentTimeMillis() - startedAtMillis));
            audit(reason == FinishReason.ERROR ? AuditEventTypes.RUN_FAILED : AuditEventTypes.RUN_COMPLETED, attrs);
            LOG.info("Run {} finished: {} after {} iteration(s)", runId, reason.wireName(), summary.iterations());
            return true;
        }

        private void persist(MessageRole role, String text, String type, Map<String, Object> payload) {
            PersistenceHook hook = context.persistence();
            try {
                hook.save(role, text, type, payload);
            } catch (RuntimeException e) {
                LOG.warn("Persistence hook failed for {} message: {}", type, e.getMessage());
            }
        }

        private void audit(String type, Map<String, Object> attributes) {
            if (observability != null) {
                observability.recordQuietly(type, attributes);
            }
        }
    }

    /**
     * Turns streamed {@code emit_text} input fragments into {@code text_delta} events.
     */
    private static final class TextDeltaForwarder implements LlmStreamListener {
        private final EventSink sink;
        private final Map<Integer, ToolInputTextExtractor> extractors = new HashMap<>();

        private TextDeltaForwarder(EventSink sink) {
            this.sink = sink;
        }

        @Override
        public void onToolInputDelta(int index, String toolUseId, String toolName, String partialJson) {
            if (!ToolName.EMIT_TEXT.wireName().equals(toolName)) {
                return;
            }
            String delta = extractors.computeIfAbsent(index, ignored -> new ToolInputTextExtractor()).feed(partialJson);
            if (!delta.isEmpty()) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("tool_use_id", toolUseId);
                data.put("delta", delta);
                sink.emit(AgentEvent.of(EventType.TEXT_DELTA, data));
            }
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
