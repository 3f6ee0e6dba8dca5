package io.tabula.core.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabula.core.model.ChatMessage;
import io.tabula.core.provider.LlmProvider;
import io.tabula.core.provider.LlmProviderException;
import io.tabula.core.provider.LlmRequest;
import io.tabula.core.provider.LlmResponse;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grades responses with a second model call. Never throws: any provider or parse failure yields a
 * neutral {@code pass} verdict so a broken judge cannot block a run.
 */
public final class LlmJudge {
    private static final Logger LOG = LoggerFactory.getLogger(LlmJudge.class);
    private static final int MAX_TOKENS = 512;

    static final String RESPONSE_SYSTEM_PROMPT = """
        You are a strict quality evaluator for a data analysis assistant.

        Given a user's question, the raw query results and the assistant's response, evaluate whether
        the response is relevant, accurate and complete.

        Score each dimension from 0 to 10:
        - relevance: does the response directly address what the user asked?
        - accuracy: are the numbers and claims grounded in the query results? Derived numbers
          (totals, averages, percentages computed from the data) count as accurate.
        - completeness: does the response answer the question? A concise correct answer beats a
          verbose incorrect one.

        Verdict: "pass" when all scores are 7 or more, "warn" when any score is 5 or 6, "retry" when
        any score is below 5. If no query result is available, set accuracy to 10.

        Return ONLY valid JSON:
        {"relevance": <int>, "accuracy": <int>, "completeness": <int>, "verdict": "<pass|warn|retry>", "feedback": "<1-2 sentences>"}
        """;

    static final String TURN_SYSTEM_PROMPT = """
        You are a quality evaluator for a data analysis assistant's complete turn.

        Given the user's question, every message sent to the user, every query result and the plots
        created, score relevance, accuracy and completeness from 0 to 10. Completeness includes
        whether a visualization was created when the question called for one.

        Verdict: "pass" when all scores are 7 or more, "warn" when any score is 5 or 6, "retry" when
        any score is below 5.

        Return ONLY valid JSON:
        {"relevance": <int>, "accuracy": <int>, "completeness": <int>, "verdict": "<pass|warn|retry>", "feedback": "<1-2 sentences>"}
        """;

    private final LlmProvider provider;
    private final String model;
    private final ObjectMapper mapper = new ObjectMapper();

    public LlmJudge(LlmProvider provider, String model) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    public JudgeVerdict evaluateResponse(String question, List<String> previews, String response) {
        String results = previews == null || previews.isEmpty()
            ? "No query was executed."
            : truncate(String.join("\n---\n", previews), 1000);
        String prompt = """
            ## User Question
            %s

            ## Query Results
            %s

            ## Assistant Response
            %s

            Evaluate this response.""".formatted(safe(question), results, safe(response));
        return ask(RESPONSE_SYSTEM_PROMPT, prompt, "response");
    }

    public JudgeVerdict evaluateTurn(String question, List<String> messages, List<String> previews, List<String> plots) {
        String messagesText = messages == null || messages.isEmpty() ? "No messages sent." : String.join("\n---\n", messages);
        String resultsText = previews == null || previews.isEmpty()
            ? "No queries executed."
            : String.join("\n---\n", previews.stream().map(p -> truncate(p, 500)).toList());
        String plotsText = plots == null || plots.isEmpty() ? "No plots created." : String.join(", ", plots);
        String prompt = """
            ## User Question
            %s

            ## All Messages Sent to User
            %s

            ## All Query Results
            %s

            ## Plots Created
            %s

            Evaluate the overall quality of this turn.""".formatted(safe(question), messagesText, resultsText, plotsText);
        return ask(TURN_SYSTEM_PROMPT, prompt, "turn");
    }

    private JudgeVerdict ask(String systemPrompt, String prompt, String scope) {
        try {
            LlmResponse response = provider.complete(new LlmRequest(
                model,
                systemPrompt,
                List.of(ChatMessage.user(prompt)),
                List.of(),
                MAX_TOKENS
            ));
            JudgeVerdict verdict = parse(response.text());
            LOG.info("Judge {} verdict: {} (rel={}, acc={}, comp={})",
                scope, verdict.verdict(), verdict.relevance(), verdict.accuracy(), verdict.completeness());
            return verdict;
        } catch (LlmProviderException | IOException | RuntimeException e) {
            LOG.warn("Judge {} evaluation failed: {}", scope, e.getMessage());
            return JudgeVerdict.fallback("Judge " + scope + " evaluation failed: " + e.getMessage());
        }
    }

    JudgeVerdict parse(String text) throws IOException {
        String json = extractJson(text);
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("Judge returned no JSON object");
        }
        return new JudgeVerdict(
            root.path("relevance").asInt(5),
            root.path("accuracy").asInt(5),
            root.path("completeness").asInt(5),
            root.path("verdict").asText(JudgeVerdict.PASS),
            root.path("feedback").asText("")
        );
    }

    private String extractJson(String text) throws IOException {
        String raw = text == null ? "" : text.trim();
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new IOException("Judge returned no JSON object");
        }
        return raw.substring(start, end + 1);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
