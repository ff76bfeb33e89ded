package com.flint.aggregator.link;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one link attempt. Exactly one transition out of {@link LinkState#OPENED} succeeds; the
 * winner tears down every listener and scheduled task the session owns.
 */
public final class LinkSession {

    private static final Logger log = LoggerFactory.getLogger(LinkSession.class);

    private final UUID id;
    private final LinkTransport transport;
    private final Instant startedAt;
    private final Instant timeoutAt;
    private final Consumer<LinkCompletion> onComplete;
    private final Consumer<LinkFlowException> onError;

    private final AtomicReference<LinkState> state = new AtomicReference<>(LinkState.IDLE);
    private final CompletableFuture<LinkCompletion> completion = new CompletableFuture<>();
    private final List<ListenerRegistration> registrations = new CopyOnWriteArrayList<>();
    private final List<Future<?>> tasks = new CopyOnWriteArrayList<>();

    LinkSession(
            UUID id,
            LinkTransport transport,
            Instant startedAt,
            Instant timeoutAt,
            Consumer<LinkCompletion> onComplete,
            Consumer<LinkFlowException> onError
    ) {
        this.id = id;
        this.transport = transport;
        this.startedAt = startedAt;
        this.timeoutAt = timeoutAt;
        this.onComplete = onComplete;
        this.onError = onError;
    }

    public UUID id() {
        return id;
    }

    public LinkTransport transport() {
        return transport;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant timeoutAt() {
        return timeoutAt;
    }

    public LinkState state() {
        return state.get();
    }

    public CompletableFuture<LinkCompletion> completion() {
        return completion;
    }

    void markOpened() {
        state.compareAndSet(LinkState.IDLE, LinkState.OPENED);
    }

    /**
     * @return {@code true} only for the caller that moved the session into {@code terminal}
     */
    boolean transition(LinkState terminal) {
        LinkState current = state.get();
        while (!current.isTerminal()) {
            if (state.compareAndSet(current, terminal)) {
                return true;
            }
            current = state.get();
        }
        return false;
    }

    void register(ListenerRegistration registration) {
        registrations.add(registration);
        if (state.get().isTerminal()) {
            release();
        }
    }

    void track(Future<?> task) {
        tasks.add(task);
        if (state.get().isTerminal()) {
            release();
        }
    }

    void release() {
        for (ListenerRegistration registration : registrations) {
            if (registrations.remove(registration)) {
                try {
                    registration.remove();
                } catch (RuntimeException e) {
                    log.warn("Failed to remove link listener for session {}: {}", id, e.toString());
                }
            }
        }
        for (Future<?> task : tasks) {
            if (tasks.remove(task)) {
                task.cancel(false);
            }
        }
    }

    void succeed(LinkCompletion result) {
        if (onComplete != null) {
            try {
                onComplete.accept(result);
            } catch (RuntimeException e) {
                log.warn("Link completion callback failed for session {}", id, e);
            }
        }
        completion.complete(result);
    }

    void fail(LinkFlowException error) {
        if (onError != null) {
            try {
                onError.accept(error);
            } catch (RuntimeException e) {
                log.warn("Link error callback failed for session {}", id, e);
            }
        }
        completion.completeExceptionally(error);
    }
}
