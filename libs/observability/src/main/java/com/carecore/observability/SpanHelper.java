package com.carecore.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that attaches the current
 * {@link CorrelationContext} (run, unit, role, patient) to every span.
 * <p>
 * Does not configure the SDK; the hosting process decides on exporters. Without one,
 * {@link #noop()} gives a helper whose spans cost nothing.
 */
public final class SpanHelper {

    /** Instrumentation scope name used by the simulator. */
    public static final String INSTRUMENTATION_NAME = "com.carecore.icu";

    private final Tracer tracer;

    /**
     * Creates a SpanHelper backed by the given OTel tracer.
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** A helper backed by the no-op OpenTelemetry implementation. */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
    }

    /**
     * Executes a {@link Callable} within a new internal span.
     *
     * @throws Exception if the callable throws
     */
    public <T> T withSpan(String spanName, Callable<T> callable) throws Exception {
        return withSpan(spanName, SpanKind.INTERNAL, Map.of(), callable);
    }

    /**
     * Executes a {@link Callable} within a new span with explicit kind and attributes. The span
     * is marked ERROR and records the exception when the callable throws.
     *
     * @throws Exception if the callable throws
     */
    public <T> T withSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                          Callable<T> callable) throws Exception {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);

        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            setIfPresent(span, "run.id", ctx.runId());
            setIfPresent(span, "engine.unit", ctx.unit());
            setIfPresent(span, "agent.role", ctx.role());
            setIfPresent(span, "patient.id", ctx.patientId());
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = callable.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static void setIfPresent(Span span, String key, String value) {
        if (value != null) {
            span.setAttribute(key, value);
        }
    }

    /** Returns the underlying OTel tracer. */
    public Tracer tracer() {
        return tracer;
    }
}
