package io.tabula.core.agent;

import io.tabula.core.event.AgentEvent;
import io.tabula.core.event.EventSink;
import io.tabula.core.event.EventType;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class RunEmitter implements EventSink {
    private static final Logger LOG = LoggerFactory.getLogger(RunEmitter.class);

    private final EventSink delegate;
    private boolean closed;
    private boolean visibleOutput;

    RunEmitter(EventSink delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public synchronized void emit(AgentEvent event) {
        if (closed) {
            LOG.debug("Dropping {} event after done", event.type().wireName());
            return;
        }
        if (event.type() == EventType.DONE) {
            closed = true;
        }
        visibleOutput |= event.type().visibleOutput();
        delegate.emit(event);
    }

    synchronized boolean producedVisibleOutput() {
        return visibleOutput;
    }
}
