package io.harrier.core.bus;

import io.harrier.api.event.EventSubscriber;
import io.harrier.api.event.RunEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded buffer plus dispatcher thread feeding one subscriber.
 */
class SubscriberChannel {

    private static final Logger log = LoggerFactory.getLogger(SubscriberChannel.class);
    private static final long POLL_INTERVAL_MS = 50;

    private final EventSubscriber subscriber;
    private final BlockingQueue<RunEvent> buffer;
    private final Thread dispatcher;
    private final AtomicLong delivered = new AtomicLong(0);
    private volatile boolean closing = false;
    private volatile boolean abandoned = false;

    SubscriberChannel(EventSubscriber subscriber, int capacity, String threadName) {
        this.subscriber = subscriber;
        this.buffer = new ArrayBlockingQueue<>(capacity);
        this.dispatcher = new Thread(this::dispatch, threadName);
        this.dispatcher.setDaemon(true);
    }

    void start() {
        dispatcher.start();
    }

    /**
     * @return false if the buffer is full
     */
    boolean offer(RunEvent event) {
        return buffer.offer(event);
    }

    /**
     * Deliver what is buffered, then stop.
     */
    void close() {
        closing = true;
    }

    /**
     * Stop without delivering buffered events.
     */
    void abandon() {
        abandoned = true;
        closing = true;
        buffer.clear();
    }

    boolean awaitTermination(long timeoutMs) throws InterruptedException {
        dispatcher.join(Math.max(1, timeoutMs));
        return !dispatcher.isAlive();
    }

    String name() {
        return subscriber.name();
    }

    int buffered() {
        return buffer.size();
    }

    private void dispatch() {
        try {
            while (!abandoned) {
                RunEvent event = buffer.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (event == null) {
                    if (closing) {
                        break;
                    }
                    continue;
                }
                deliver(event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Dispatcher for subscriber '{}' interrupted", name());
        }
        log.debug("Dispatcher for subscriber '{}' stopped after {} events", name(), delivered.get());
    }

    private void deliver(RunEvent event) {
        try {
            subscriber.onEvent(event);
        } catch (Exception e) {
            log.warn("Subscriber '{}' failed to handle {}: {}", name(), event.getClass().getSimpleName(),
                    e.getMessage(), e);
        } finally {
            delivered.incrementAndGet();
        }
    }
}
