package io.tabula.core.agent;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class RunHandle {
    private final TurnOrchestrator.Run run;
    private final Future<?> task;

    RunHandle(TurnOrchestrator.Run run, Future<?> task) {
        this.run = run;
        this.task = task;
    }

    /**
     * Stops the run. If it has not terminated yet, {@code done} with {@code finish_reason=cancelled}
     * is emitted before this returns and the run task is interrupted.
     *
     * @return true when this call terminated the run
     */
    public boolean cancel() {
        boolean terminated = run.terminate(FinishReason.CANCELLED);
        if (terminated) {
            task.cancel(true);
        }
        return terminated;
    }

    public boolean isDone() {
        return run.outcome().isDone();
    }

    public TurnState state() {
        return run.state();
    }

    public RunSummary await() throws InterruptedException {
        try {
            return run.outcome().get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run outcome failed", e.getCause());
        }
    }

    public RunSummary await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return run.outcome().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run outcome failed", e.getCause());
        }
    }
}
