package io.tabula.core.event;

/**
 * Ordered, append-only destination for run events. Implementations must be safe to call from
 * several threads; events from one thread are delivered in call order.
 */
@FunctionalInterface
public interface EventSink {
    void emit(AgentEvent event);
}
