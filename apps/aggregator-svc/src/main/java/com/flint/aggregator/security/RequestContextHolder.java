package com.flint.aggregator.security;

import java.util.Optional;
import java.util.UUID;

/**
 * Trace id and caller of the request being served on this thread.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    static void open(String traceId, UUID userId) {
        CONTEXT.set(new RequestContext(traceId, userId));
    }

    static void clear() {
        CONTEXT.remove();
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> traceId() {
        return get().map(RequestContext::traceId);
    }

    public static Optional<UUID> userId() {
        return get().map(RequestContext::userId);
    }

    /**
     * {@code userId} is null when the caller did not identify itself.
     */
    public record RequestContext(String traceId, UUID userId) {
    }
}
