package com.chainwatch.common;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal shared by every operation spawned for a single owner.
 * Callbacks registered with {@link #onCancel(Runnable)} run exactly once, either on {@link #cancel()}
 * or immediately when registered after cancellation. Owners whose work ends before the token is cancelled
 * dispose the registration so the token does not accumulate callbacks.
 */
@Slf4j
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Sinks.Empty<Void> signal = Sinks.empty();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Cancels the token. Returns false when it was already cancelled.
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        signal.tryEmitEmpty();
        for (Runnable callback : callbacks) {
            runOnce(callback);
        }
        return true;
    }

    /**
     * @return registration; disposing it removes the callback without running it
     */
    public Disposable onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get()) {
            runOnce(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Number of callbacks still waiting for {@link #cancel()}.
     */
    public int pendingCallbacks() {
        return callbacks.size();
    }

    /**
     * Completes (empty) when the token is cancelled. Use with {@code takeUntilOther}.
     */
    public Mono<Void> asMono() {
        return signal.asMono();
    }

    /**
     * New token cancelled together with this one; cancelling the child does not affect the parent.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        onCancel(child::cancel);
        return child;
    }

    private void runOnce(Runnable callback) {
        if (!callbacks.remove(callback)) {
            return;
        }
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage());
        }
    }
}
