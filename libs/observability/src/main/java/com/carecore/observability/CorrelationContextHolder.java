package com.carecore.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * Each engine unit runs on its own thread and sets its context once; reasoning calls handed to a
 * worker pool must carry the context over explicitly with {@link #runWithContext} or
 * {@link #callWithContext}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /** Returns the current thread's correlation context, if set. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Clears the correlation context and removes all MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Executes a {@link Runnable} with the given context set, then restores the previous context
     * (or clears if there was none).
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            restore(previous);
        }
    }

    /**
     * Executes a {@link Callable} with the given context set and returns its result, restoring
     * the previous context afterwards.
     *
     * @throws Exception whatever the callable throws
     */
    public static <T> T callWithContext(CorrelationContext context, Callable<T> callable)
            throws Exception {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return callable.call();
        } finally {
            restore(previous);
        }
    }

    private static void restore(CorrelationContext previous) {
        if (previous != null) {
            set(previous);
        } else {
            clear();
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_RUN_ID, ctx.runId());
        setMdc(CorrelationContext.MDC_UNIT, ctx.unit());
        setMdc(CorrelationContext.MDC_ROLE, ctx.role());
        setMdc(CorrelationContext.MDC_PATIENT_ID, ctx.patientId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_RUN_ID);
        MDC.remove(CorrelationContext.MDC_UNIT);
        MDC.remove(CorrelationContext.MDC_ROLE);
        MDC.remove(CorrelationContext.MDC_PATIENT_ID);
    }
}
