package io.tabula.core.provider;

public final class DisabledProvider implements LlmProvider {
    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse complete(LlmRequest request) throws LlmProviderException {
        throw new LlmProviderException("Provider " + name + " is not configured (" + reason + ")", -1);
    }
}
