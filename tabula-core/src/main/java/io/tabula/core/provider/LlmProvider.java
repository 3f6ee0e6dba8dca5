package io.tabula.core.provider;

public interface LlmProvider {
    String name();

    LlmResponse complete(LlmRequest request) throws LlmProviderException;

    /**
     * Streaming variant. Providers without streaming support answer in one piece and never call the listener.
     */
    default LlmResponse complete(LlmRequest request, LlmStreamListener listener) throws LlmProviderException {
        return complete(request);
    }
}
