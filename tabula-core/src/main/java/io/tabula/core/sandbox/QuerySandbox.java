package io.tabula.core.sandbox;

import io.tabula.core.dataset.DatasetSnapshot;

/**
 * Executes one generated query or script against a dataset snapshot.
 * Implementations never throw: every failure is reported through {@link ExecutionResult#failure}.
 */
public interface QuerySandbox {
    ExecutionResult execute(String code, DatasetSnapshot snapshot);
}
