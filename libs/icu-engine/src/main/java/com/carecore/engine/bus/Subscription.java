package com.carecore.engine.bus;

import com.carecore.eventmodel.EventEnvelope;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * One subscriber's bounded, ordered view of the bus.
 *
 * <p>Exactly one consumer thread pulls with {@link #next()}; any number of producers offer
 * through the owning {@link MessageBus}. When the queue is full the offering producer blocks
 * until the consumer frees a slot. After {@link #close()} the queued backlog is still handed out
 * and then {@link #next()} returns empty.
 *
 * <p>An event handed out by {@link #next()} counts as unfinished until the consumer asks for
 * the following one, so {@link #pending()} never drops to zero while an event is being handled.
 */
public final class Subscription {

    private static final long ABANDON_CHECK_NANOS = TimeUnit.MILLISECONDS.toNanos(20);

    private final String name;
    private final EventFilter filter;
    private final int capacity;
    private final ArrayDeque<EventEnvelope<?>> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean closed;
    private boolean processing;
    private long delivered;

    Subscription(String name, EventFilter filter, int capacity) {
        this.name = name;
        this.filter = filter;
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 256));
    }

    public String name() {
        return name;
    }

    boolean accepts(EventEnvelope<?> event) {
        return filter.accepts(event);
    }

    /**
     * Appends an event, blocking while the queue is full.
     *
     * @throws BusClosedException if the subscription is closed before space frees up
     */
    void offer(EventEnvelope<?> event) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.size() >= capacity && !closed) {
                notFull.await();
            }
            if (closed) {
                throw new BusClosedException("Subscription '" + name + "' is closed");
            }
            queue.addLast(event);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends an event, waiting while the queue is full until {@code deadlineNanos} (a
     * {@link System#nanoTime()} value) passes or {@code abandon} reports true.
     *
     * @return false if the event was not queued in time
     * @throws BusClosedException if the subscription is closed before space frees up
     */
    boolean offer(EventEnvelope<?> event, long deadlineNanos, BooleanSupplier abandon) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.size() >= capacity && !closed) {
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0 || abandon.getAsBoolean()) {
                    return false;
                }
                notFull.awaitNanos(Math.min(remaining, ABANDON_CHECK_NANOS));
            }
            if (closed) {
                throw new BusClosedException("Subscription '" + name + "' is closed");
            }
            queue.addLast(event);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the next event is available or the subscription is closed and drained.
     *
     * @return the next event, or empty once closed and drained
     */
    public Optional<EventEnvelope<?>> next() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            processing = false;
            while (queue.isEmpty() && !closed) {
                notEmpty.await();
            }
            return Optional.ofNullable(take());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #next()} but gives up after {@code timeout}; empty on timeout or when drained.
     */
    public Optional<EventEnvelope<?>> poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            processing = false;
            while (queue.isEmpty() && !closed) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return Optional.ofNullable(take());
        } finally {
            lock.unlock();
        }
    }

    private EventEnvelope<?> take() {
        EventEnvelope<?> event = queue.pollFirst();
        if (event != null) {
            delivered++;
            processing = true;
            notFull.signal();
        }
        return event;
    }

    /** Number of queued, not yet pulled events. */
    public int backlog() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /** Queued events plus the one the consumer is still handling, if any. */
    public int pending() {
        lock.lock();
        try {
            return queue.size() + (processing ? 1 : 0);
        } finally {
            lock.unlock();
        }
    }

    /** Number of events handed to the consumer so far. */
    public long deliveredCount() {
        lock.lock();
        try {
            return delivered;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** True once closed and every queued event has been pulled. */
    public boolean isDrained() {
        lock.lock();
        try {
            return closed && queue.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
