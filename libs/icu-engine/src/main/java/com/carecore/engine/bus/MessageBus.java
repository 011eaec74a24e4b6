package com.carecore.engine.bus;

import com.carecore.eventmodel.EventEnvelope;
import com.carecore.eventmodel.EventType;
import com.carecore.eventmodel.EventValidator;
import com.carecore.eventmodel.ValidationResult;
import com.carecore.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Multi-producer, multi-consumer event channel with one bounded queue per subscriber.
 *
 * <p>Delivery guarantees:
 * <ul>
 *   <li>every subscriber whose filter accepts an event receives it exactly once;</li>
 *   <li>events from one producer arrive at each subscriber in publish order;</li>
 *   <li>events from different producers may interleave arbitrarily.</li>
 * </ul>
 *
 * <p>Publishing blocks only the publishing thread, and only while a target queue is full.
 * Closing stops new publishes; subscribers still drain what was queued before the close.
 */
public final class MessageBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    public static final int DEFAULT_CAPACITY = 1024;

    private final int capacity;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Map<String, ReentrantLock> producerLocks = new ConcurrentHashMap<>();
    private final Map<EventType, Counter> publishedCounters = new EnumMap<>(EventType.class);
    private final AtomicLong published = new AtomicLong();
    private volatile boolean closed;

    public MessageBus(int capacity, MetricFactory metrics) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.capacity = capacity;
        for (EventType type : EventType.values()) {
            publishedCounters.put(type, metrics.counter(
                    "icu.bus.events.published", "Events published on the ICU bus", "type", type.value()));
        }
    }

    /**
     * Registers a subscriber. Only events published after this call are delivered to it.
     *
     * @throws BusClosedException if the bus is already closed
     */
    public Subscription subscribe(String name, EventFilter filter) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("subscription name must not be null or blank");
        }
        if (filter == null) {
            throw new IllegalArgumentException("filter must not be null");
        }
        if (closed) {
            throw new BusClosedException("Cannot subscribe '" + name + "': bus is closed");
        }
        Subscription subscription = new Subscription(name, filter, capacity);
        subscriptions.add(subscription);
        log.debug("Subscribed '{}' (capacity {})", name, capacity);
        return subscription;
    }

    /** Removes and closes a subscription; it still drains what it had queued. */
    public void unsubscribe(Subscription subscription) {
        if (subscriptions.remove(subscription)) {
            subscription.close();
        }
    }

    /**
     * Validates the event and fans it out to every accepting subscriber.
     *
     * <p>Fan-out for one producer is serialized so that no subscriber can observe two of that
     * producer's events out of order, even if the producer publishes from several threads.
     *
     * @throws IllegalArgumentException if the envelope is invalid
     * @throws BusClosedException       if the bus is closed
     * @throws InterruptedException     if interrupted while waiting for queue space
     */
    public void publish(EventEnvelope<?> event) throws InterruptedException {
        ValidationResult validation = EventValidator.validate(event);
        if (!validation.valid()) {
            throw new IllegalArgumentException("Invalid event: " + validation.summary());
        }
        if (closed) {
            throw new BusClosedException("Cannot publish " + event.eventType() + " from '"
                    + event.producer() + "': bus is closed");
        }
        ReentrantLock producerLock = producerLocks.computeIfAbsent(event.producer(), p -> new ReentrantLock());
        producerLock.lockInterruptibly();
        try {
            for (Subscription subscription : subscriptions) {
                if (subscription.accepts(event)) {
                    subscription.offer(event);
                }
            }
        } finally {
            producerLock.unlock();
        }
        published.incrementAndGet();
        publishedCounters.get(event.type()).increment();
    }

    /**
     * Like {@link #publish(EventEnvelope)}, but waits for queue space at most {@code timeout} in
     * total and gives up early once {@code abandon} reports true.
     *
     * <p>A publish that gives up may already have reached some subscribers; callers treat it as
     * a stalled bus and close it.
     *
     * @return true if every accepting subscriber received the event
     * @throws BusClosedException if the bus is closed
     */
    public boolean tryPublish(EventEnvelope<?> event, Duration timeout, BooleanSupplier abandon)
            throws InterruptedException {
        ValidationResult validation = EventValidator.validate(event);
        if (!validation.valid()) {
            throw new IllegalArgumentException("Invalid event: " + validation.summary());
        }
        if (closed) {
            throw new BusClosedException("Cannot publish " + event.eventType() + " from '"
                    + event.producer() + "': bus is closed");
        }
        long deadline = System.nanoTime() + Math.max(0, timeout.toNanos());
        ReentrantLock producerLock = producerLocks.computeIfAbsent(event.producer(), p -> new ReentrantLock());
        producerLock.lockInterruptibly();
        try {
            for (Subscription subscription : subscriptions) {
                if (subscription.accepts(event) && !subscription.offer(event, deadline, abandon)) {
                    log.warn("Publish of {} from '{}' gave up on full queue '{}'", event.eventType(),
                            event.producer(), subscription.name());
                    return false;
                }
            }
        } finally {
            producerLock.unlock();
        }
        published.incrementAndGet();
        publishedCounters.get(event.type()).increment();
        return true;
    }

    /** Sum of all subscriber backlogs. */
    public int totalBacklog() {
        int total = 0;
        for (Subscription subscription : subscriptions) {
            total += subscription.backlog();
        }
        return total;
    }

    public long publishedCount() {
        return published.get();
    }

    public int capacity() {
        return capacity;
    }

    public List<Subscription> subscriptions() {
        return List.copyOf(subscriptions);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the bus. Idempotent. Pending consumers wake up, drain their backlog, then see the
     * closure signal.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        subscriptions.forEach(Subscription::close);
        log.info("Message bus closed after {} events", published.get());
    }
}
