package io.tabula.core.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

public final class InMemoryEventChannel implements EventSink {
    private final LinkedBlockingQueue<AgentEvent> queue = new LinkedBlockingQueue<>();

    @Override
    public void emit(AgentEvent event) {
        queue.offer(event);
    }

    public Optional<AgentEvent> poll() {
        return Optional.ofNullable(queue.poll());
    }

    public Optional<AgentEvent> poll(long timeout, TimeUnit unit) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout, unit));
    }

    public List<AgentEvent> drain() {
        List<AgentEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }
}
