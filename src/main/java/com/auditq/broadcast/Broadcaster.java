package com.auditq.broadcast;

import org.slf4j.LoggerFactory;

/**
 * Fire-and-forget push channel for job and run state changes. Delivery is best effort: subscribers
 * that are offline miss events and reconcile by reading the job store.
 */
public interface Broadcaster {

    void publish(String topic, BroadcastEvent event);

    /**
     * Publishes and logs instead of propagating any failure, so a broken channel never fails the
     * state transition being announced.
     */
    default void publishQuietly(String topic, BroadcastEvent event) {
        try {
            publish(topic, event);
        } catch (RuntimeException e) {
            LoggerFactory.getLogger(Broadcaster.class)
                    .warn("Failed to publish {} event on topic {}", event.type(), topic, e);
        }
    }
}
