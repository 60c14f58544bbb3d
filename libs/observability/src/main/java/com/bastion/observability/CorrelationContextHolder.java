package com.bastion.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext}, mirrored into SLF4J MDC.
 * <p>
 * Requests are served one per thread, so a ThreadLocal is enough. Callers that hand work
 * to another thread must transfer the context with {@link #runWithContext}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        putOrRemove(CorrelationContext.MDC_TENANT, context.tenantKey());
    }

    /** Returns the current thread's context, if any. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Returns the current correlation ID, or null outside a correlated call. */
    public static String currentCorrelationId() {
        CorrelationContext ctx = CONTEXT.get();
        return ctx != null ? ctx.correlationId() : null;
    }

    /** Clears the context and its MDC keys. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT);
    }

    /**
     * Runs {@code runnable} under {@code context}, then restores whatever was there before.
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
