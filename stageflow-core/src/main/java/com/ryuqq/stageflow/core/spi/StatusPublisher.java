package com.ryuqq.stageflow.core.spi;

import com.ryuqq.stageflow.core.model.StatusEvent;

/**
 * Outbound progress notification SPI.
 *
 * <p>Delivery is best effort: the orchestrator logs and ignores failures of this call.</p>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StatusPublisher {

    /**
     * Publishes a status event.
     *
     * @param event the event
     */
    void publish(StatusEvent event);
}
