package com.auditq.broadcast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process broadcaster that pushes events to Server-Sent-Event subscribers of this node.
 */
public class SseBroadcaster implements Broadcaster {

    private static final Logger log = LoggerFactory.getLogger(SseBroadcaster.class);

    private final Map<String, List<SseEmitter>> subscribers = new ConcurrentHashMap<>();
    private final Duration subscriptionTimeout;

    public SseBroadcaster(Duration subscriptionTimeout) {
        this.subscriptionTimeout = subscriptionTimeout;
    }

    public SseEmitter subscribe(String topic) {
        SseEmitter emitter = new SseEmitter(subscriptionTimeout.toMillis());
        // Empty lists are removed by unsubscribe, so joining happens inside compute.
        List<SseEmitter> emitters = subscribers.compute(topic, (key, current) -> {
            List<SseEmitter> list = current != null ? current : new CopyOnWriteArrayList<>();
            list.add(emitter);
            return list;
        });
        emitter.onCompletion(() -> unsubscribe(topic, emitter));
        emitter.onTimeout(() -> unsubscribe(topic, emitter));
        emitter.onError(error -> unsubscribe(topic, emitter));
        log.debug("New subscriber on topic {} ({} total)", topic, emitters.size());
        return emitter;
    }

    @Override
    public void publish(String topic, BroadcastEvent event) {
        List<SseEmitter> emitters = subscribers.get(topic);
        if (emitters == null || emitters.isEmpty()) {
            return;
        }
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(event.type()).data(event));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping subscriber on topic {} after failed send: {}", topic, e.getMessage());
                unsubscribe(topic, emitter);
            }
        }
    }

    public int subscriberCount(String topic) {
        List<SseEmitter> emitters = subscribers.get(topic);
        return emitters == null ? 0 : emitters.size();
    }

    private void unsubscribe(String topic, SseEmitter emitter) {
        subscribers.computeIfPresent(topic, (key, emitters) -> {
            emitters.remove(emitter);
            return emitters.isEmpty() ? null : emitters;
        });
    }
}
