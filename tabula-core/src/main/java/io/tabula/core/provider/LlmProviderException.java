package io.tabula.core.provider;

public final class LlmProviderException extends Exception {
    private final int statusCode;

    public LlmProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public LlmProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status code, or -1 when the failure happened outside HTTP
     */
    public int statusCode() {
        return statusCode;
    }

    public boolean httpError() {
        return statusCode > 0;
    }
}
