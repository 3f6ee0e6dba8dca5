package io.tabula.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabula.core.model.ChatMessage;
import io.tabula.core.model.ContentBlock;
import io.tabula.core.model.MessageRole;
import io.tabula.core.model.TextBlock;
import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolResultBlock;
import io.tabula.core.model.ToolUseBlock;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AnthropicProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(AnthropicProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;

    public AnthropicProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, 3);
    }

    public AnthropicProvider(String name, String apiKey, String apiBase, int maxAttempts) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(120))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse complete(LlmRequest request) throws LlmProviderException {
        return send(request, null);
    }

    @Override
    public LlmResponse complete(LlmRequest request, LlmStreamListener listener) throws LlmProviderException {
        return send(request, listener);
    }

    private LlmResponse send(LlmRequest request, LlmStreamListener listener) throws LlmProviderException {
        if (apiKey.isBlank()) {
            throw new LlmProviderException("Missing API key for provider " + name, -1);
        }

        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            StreamState stream = new StreamState();
            try {
                Request httpRequest = buildRequest(request, listener != null);
                try (Response response = client.newCall(httpRequest).execute()) {
                    if (!response.isSuccessful()) {
                        String errorBody = response.body() == null ? "" : response.body().string();
                        boolean retryable = response.code() == 429 || response.code() >= 500;
                        if (retryable && attempt < maxAttempts) {
                            LOG.debug("Provider {} returned HTTP {}, retrying", name, response.code());
                            delayMs = backoff(delayMs);
                            continue;
                        }
                        throw new LlmProviderException("HTTP " + response.code() + " " + errorBody, response.code());
                    }

                    ResponseBody body = response.body();
                    if (body == null) {
                        return new LlmResponse(List.of(), "", Map.of());
                    }
                    if (listener == null) {
                        return parseResponse(body.string());
                    }
                    return readStream(body.source(), listener, stream);
                }
            } catch (IOException ioe) {
                // once deltas reached the listener a retry would replay them
                if (attempt < maxAttempts && !stream.started) {
                    LOG.debug("Provider {} call failed ({}), retrying", name, ioe.getMessage());
                    delayMs = backoff(delayMs);
                    continue;
                }
                throw new LlmProviderException("Error calling LLM: " + ioe.getMessage(), -1, ioe);
            }
        }

        throw new LlmProviderException("Error calling LLM: exhausted retries", -1);
    }

    private Request buildRequest(LlmRequest request, boolean stream) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("max_tokens", request.maxTokens());
        if (!request.systemPrompt().isBlank()) {
            payload.put("system", request.systemPrompt());
        }
        payload.put("messages", toWireMessages(request.messages()));
        if (!request.tools().isEmpty()) {
            payload.put("tools", request.tools());
        }
        if (stream) {
            payload.put("stream", true);
        }

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(messagesUrl())
            .post(body)
            .header("x-api-key", apiKey)
            .header("anthropic-version", "2023-06-01")
            .header("content-type", "application/json")
            .build();
    }

    private HttpUrl messagesUrl() {
        return apiBase.newBuilder()
            .addPathSegment("messages")
            .build();
    }

    List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role() == MessageRole.ASSISTANT ? "assistant" : "user");

            List<ContentBlock> blocks = message.content();
            if (blocks.size() == 1 && blocks.get(0) instanceof TextBlock text) {
                row.put("content", text.text());
                wire.add(row);
                continue;
            }

            List<Map<String, Object>> content = new ArrayList<>();
            for (ContentBlock block : blocks) {
                if (block instanceof TextBlock text) {
                    if (!text.text().isBlank()) {
                        content.add(Map.of("type", "text", "text", text.text()));
                    }
                } else if (block instanceof ToolUseBlock toolUse) {
                    ToolInvocation invocation = toolUse.invocation();
                    content.add(Map.of(
                        "type", "tool_use",
                        "id", invocation.id(),
                        "name", invocation.name(),
                        "input", invocation.arguments()
                    ));
                } else if (block instanceof ToolResultBlock result) {
                    content.add(Map.of(
                        "type", "tool_result",
                        "tool_use_id", result.toolUseId(),
                        "content", result.content(),
                        "is_error", result.error()
                    ));
                }
            }
            row.put("content", content);
            wire.add(row);
        }
        return wire;
    }

    private LlmResponse parseResponse(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        List<ContentBlock> content = new ArrayList<>();

        for (JsonNode item : root.path("content")) {
            String type = item.path("type").asText("");
            if ("text".equals(type)) {
                content.add(new TextBlock(item.path("text").asText("")));
            }
            if ("tool_use".equals(type)) {
                Map<String, Object> input = mapper.convertValue(item.path("input"), MAP_TYPE);
                content.add(new ToolUseBlock(new ToolInvocation(
                    item.path("id").asText(""),
                    item.path("name").asText(""),
                    input
                )));
            }
        }

        Map<String, Object> usage = mapper.convertValue(root.path("usage"), MAP_TYPE);
        return new LlmResponse(content, root.path("stop_reason").asText(""), usage);
    }

    private LlmResponse readStream(BufferedSource source, LlmStreamListener listener, StreamState state)
        throws IOException, LlmProviderException {
        StringBuilder data = new StringBuilder();
        String line;
        while ((line = source.readUtf8Line()) != null) {
            if (line.isEmpty()) {
                dispatchEvent(data, listener, state);
                continue;
            }
            if (line.startsWith("data:")) {
                if (data.length() > 0) {
                    data.append('\n');
                }
                data.append(line.substring(5).trim());
            }
        }
        dispatchEvent(data, listener, state);
        return state.toResponse(mapper);
    }

    private void dispatchEvent(StringBuilder data, LlmStreamListener listener, StreamState state)
        throws IOException, LlmProviderException {
        if (data.length() == 0) {
            return;
        }
        JsonNode event = mapper.readTree(data.toString());
        data.setLength(0);
        state.started = true;

        switch (event.path("type").asText("")) {
            case "message_start" -> {
                JsonNode usage = event.path("message").path("usage");
                if (usage.isObject()) {
                    state.usage.putAll(mapper.convertValue(usage, MAP_TYPE));
                }
            }
            case "content_block_start" -> {
                JsonNode block = event.path("content_block");
                StreamingBlock started = new StreamingBlock(
                    block.path("type").asText(""),
                    block.path("id").asText(""),
                    block.path("name").asText("")
                );
                started.buffer.append(block.path("text").asText(""));
                state.blocks.put(event.path("index").asInt(), started);
            }
            case "content_block_delta" -> {
                int index = event.path("index").asInt();
                StreamingBlock block = state.blocks.get(index);
                JsonNode delta = event.path("delta");
                String deltaType = delta.path("type").asText("");
                if (block == null) {
                    LOG.debug("Ignoring delta for unknown content block {}", index);
                } else if ("text_delta".equals(deltaType)) {
                    String text = delta.path("text").asText("");
                    block.buffer.append(text);
                    listener.onTextDelta(index, text);
                } else if ("input_json_delta".equals(deltaType)) {
                    String partial = delta.path("partial_json").asText("");
                    block.buffer.append(partial);
                    listener.onToolInputDelta(index, block.id, block.name, partial);
                }
            }
            case "message_delta" -> {
                state.stopReason = event.path("delta").path("stop_reason").asText(state.stopReason);
                JsonNode usage = event.path("usage");
                if (usage.isObject()) {
                    state.usage.putAll(mapper.convertValue(usage, MAP_TYPE));
                }
            }
            case "error" -> throw new LlmProviderException(
                "Stream error: " + event.path("error").path("message").asText("unknown"),
                -1
            );
            default -> {
                // ping, content_block_stop, message_stop carry nothing we keep
            }
        }
    }

    private long backoff(long delayMs) throws LlmProviderException {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LlmProviderException("Interrupted while waiting to retry", -1, ie);
        }
        return Math.min(delayMs * 2, 2000);
    }

    private static final class StreamingBlock {
        private final String type;
        private final String id;
        private final String name;
        private final StringBuilder buffer = new StringBuilder();

        private StreamingBlock(String type, String id, String name) {
            this.type = type;
            this.id = id;
            this.name = name;
        }
    }

    private static final class StreamState {
        private final Map<Integer, StreamingBlock> blocks = new TreeMap<>();
        private final Map<String, Object> usage = new LinkedHashMap<>();
        private String stopReason = "";
        private boolean started;

        private LlmResponse toResponse(ObjectMapper mapper) throws IOException {
            List<ContentBlock> content = new ArrayList<>();
            for (StreamingBlock block : blocks.values()) {
                if ("text".equals(block.type)) {
                    content.add(new TextBlock(block.buffer.toString()));
                } else if ("tool_use".equals(block.type)) {
                    String json = block.buffer.toString().trim();
                    Map<String, Object> input = json.isEmpty() ? Map.of() : mapper.readValue(json, MAP_TYPE);
                    content.add(new ToolUseBlock(new ToolInvocation(block.id, block.name, input)));
                }
            }
            return new LlmResponse(content, stopReason, usage);
        }
    }
}
