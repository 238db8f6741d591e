package com.ryuqq.stageflow.adapter.inmemory.event;

import com.ryuqq.stageflow.core.model.StatusEvent;
import com.ryuqq.stageflow.core.model.WorkflowId;
import com.ryuqq.stageflow.core.spi.StatusPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Recording {@link StatusPublisher} for tests and local runs.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public class InMemoryStatusPublisher implements StatusPublisher {

    private final List<StatusEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(StatusEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
    }

    public List<StatusEvent> events() {
        return new ArrayList<>(events);
    }

    /**
     * Returns the events of one workflow in publication order.
     *
     * @param workflowId workflow id
     * @return events of the workflow
     */
    public List<StatusEvent> eventsFor(WorkflowId workflowId) {
        return events.stream()
            .filter(event -> event.workflowId().equals(workflowId))
            .collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
