package com.bastion.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the current
 * {@link CorrelationContext}.
 * <p>
 * Does not configure the SDK. Without an agent or SDK registered globally, spans are no-ops.
 */
public final class SpanHelper {

    /** Span attribute carrying the correlation ID. */
    public static final String ATTR_CORRELATION_ID = "correlation.id";

    /** Span attribute carrying the tenant key. */
    public static final String ATTR_TENANT = "tenant.key";

    private final Tracer tracer;

    /**
     * @param tracer tracer the spans are started on (typically from {@code GlobalOpenTelemetry})
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** A helper whose spans go nowhere. */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer("bastion"));
    }

    /**
     * Runs {@code work} inside a new INTERNAL span named {@code spanName}. Exceptions mark the
     * span as failed and propagate unchanged.
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.tenantKey() != null) {
                span.setAttribute(ATTR_TENANT, ctx.tenantKey());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}
