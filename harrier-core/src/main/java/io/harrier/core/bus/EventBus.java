package io.harrier.core.bus;

import io.harrier.api.event.EventSubscriber;
import io.harrier.api.event.RunEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fan-out of run events to subscribers.
 * <p>
 * Publishing never blocks: every subscriber has its own bounded buffer drained
 * by a dedicated thread. A subscriber whose buffer is full is dropped (the run
 * goes on) and a warning is logged. Each subscriber sees events in publish order.
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final int bufferSize;
    private final List<SubscriberChannel> channels = new CopyOnWriteArrayList<>();
    private final List<String> dropped = new CopyOnWriteArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger(0);
    private volatile boolean closed = false;

    public EventBus(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive");
        }
        this.bufferSize = bufferSize;
    }

    public void subscribe(EventSubscriber subscriber) {
        if (closed) {
            throw new IllegalStateException("Event bus is closed");
        }
        SubscriberChannel channel = new SubscriberChannel(subscriber, bufferSize,
                "harrier-events-" + sequence.incrementAndGet() + "-" + subscriber.name());
        channels.add(channel);
        channel.start();
        log.debug("Subscriber '{}' attached", subscriber.name());
    }

    /**
     * Hand an event to every subscriber without waiting for any of them.
     */
    public void publish(RunEvent event) {
        if (closed) {
            log.debug("Event bus closed; discarding {}", event.getClass().getSimpleName());
            return;
        }
        for (SubscriberChannel channel : channels) {
            if (!channel.offer(event)) {
                drop(channel);
            }
        }
    }

    private void drop(SubscriberChannel channel) {
        if (channels.remove(channel)) {
            channel.abandon();
            dropped.add(channel.name());
            log.warn("Subscriber '{}' cannot keep up ({} events buffered); it is dropped and receives no further events",
                    channel.name(), bufferSize);
        }
    }

    /**
     * @return names of subscribers dropped because their buffer overflowed
     */
    public List<String> droppedSubscribers() {
        return List.copyOf(dropped);
    }

    public int subscriberCount() {
        return channels.size();
    }

    /**
     * Stop accepting events. Subscribers still receive what is already buffered.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            channels.forEach(SubscriberChannel::close);
        }
    }

    /**
     * Wait until every subscriber consumed its buffer after {@link #close()}.
     *
     * @return true if all dispatchers finished in time
     */
    public boolean awaitDrained(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean drained = true;
        for (SubscriberChannel channel : channels) {
            long remainingMs = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
            try {
                if (!channel.awaitTermination(remainingMs)) {
                    log.warn("Subscriber '{}' did not drain in time; {} events left", channel.name(), channel.buffered());
                    drained = false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return drained;
    }
}
