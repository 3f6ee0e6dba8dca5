package io.tabula.core.sandbox;

public final class QueryRejectedException extends Exception {
    public QueryRejectedException(String message) {
        super(message);
    }
}
