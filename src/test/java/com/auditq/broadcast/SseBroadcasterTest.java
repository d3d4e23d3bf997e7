package com.auditq.broadcast;

import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class SseBroadcasterTest {

    private final SseBroadcaster broadcaster = new SseBroadcaster(Duration.ofMinutes(1));

    @Test
    void shouldTrackSubscribersPerTopic() {
        broadcaster.subscribe("resource:site-1");
        broadcaster.subscribe("resource:site-1");
        broadcaster.subscribe("resource:site-2");

        assertEquals(2, broadcaster.subscriberCount("resource:site-1"));
        assertEquals(1, broadcaster.subscriberCount("resource:site-2"));
        assertEquals(0, broadcaster.subscriberCount("resource:site-3"));
    }

    @Test
    void shouldDropSubscriberWhoseStreamIsClosed() {
        SseEmitter closed = broadcaster.subscribe("resource:site-1");
        broadcaster.subscribe("resource:site-1");
        closed.complete();

        broadcaster.publish("resource:site-1", event());

        assertEquals(1, broadcaster.subscriberCount("resource:site-1"));
    }

    @Test
    void shouldKeepSubscribersThatJoinWhileOthersLeave() throws Exception {
        int subscribers = 200;
        String topic = "resource:site-1";
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> leaving = pool.submit(() -> {
                await(start);
                for (int i = 0; i < subscribers; i++) {
                    broadcaster.subscribe(topic).complete();
                    broadcaster.publish(topic, event());
                }
            });
            Future<?> joining = pool.submit(() -> {
                await(start);
                for (int i = 0; i < subscribers; i++) {
                    broadcaster.subscribe(topic);
                }
            });
            start.countDown();
            leaving.get(10, TimeUnit.SECONDS);
            joining.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        broadcaster.subscribe(topic).complete();
        broadcaster.publish(topic, event());

        assertEquals(subscribers, broadcaster.subscriberCount(topic));
    }

    @Test
    void shouldIgnoreTopicsWithoutSubscribers() {
        assertThatCode(() -> broadcaster.publish("monitoring:none", event())).doesNotThrowAnyException();
    }

    @Test
    void shouldNotPropagateFailuresWhenPublishingQuietly() {
        Broadcaster failing = mock(Broadcaster.class);
        doThrow(new IllegalStateException("redis down")).when(failing).publish(anyString(), any());
        doCallRealMethod().when(failing).publishQuietly(anyString(), any());

        assertThatCode(() -> failing.publishQuietly("resource:site-1", event())).doesNotThrowAnyException();
    }

    private static BroadcastEvent event() {
        return BroadcastEvent.of(BroadcastEvent.RUN_PROGRESS, Map.of("completedTargets", 1),
                OffsetDateTime.parse("2025-01-06T10:00:00Z"));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
