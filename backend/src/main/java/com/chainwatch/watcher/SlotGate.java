package com.chainwatch.watcher;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * Single ordering point between the stream consumer and the timer-driven polls.
 * Accepts a candidate only when its slot is greater than the last accepted one, and delivers it
 * while holding the lock, so consumers observe strictly increasing slots. Closing the gate under the
 * same lock guarantees that nothing is delivered once {@link #close()} has returned.
 */
@Slf4j
final class SlotGate<N> {

    static final long BEFORE_ALL = -1L;

    private final String name;
    private final UpdateListener<N> onUpdate;
    private final Consumer<Throwable> onError;

    private long lastAcceptedSlot = BEFORE_ALL;
    private boolean closed;

    SlotGate(String name, UpdateListener<N> onUpdate, Consumer<Throwable> onError) {
        this.name = name;
        this.onUpdate = onUpdate;
        this.onError = onError;
    }

    /**
     * Delivers {@code value} at {@code slot} unless the slot was already observed.
     *
     * @return true when the update was accepted
     */
    synchronized boolean offer(long slot, N value) {
        if (closed) {
            return false;
        }
        if (slot <= lastAcceptedSlot) {
            log.debug("[{}] dropped slot {} (last accepted {})", name, slot, lastAcceptedSlot);
            return false;
        }
        lastAcceptedSlot = slot;
        try {
            onUpdate.onUpdate(slot, value);
        } catch (RuntimeException e) {
            log.warn("[{}] update callback failed at slot {}: {}", name, slot, e.getMessage());
            report(e);
        }
        return true;
    }

    /**
     * Delivers a slot-less value at {@code lastAcceptedSlot + 1}.
     */
    synchronized boolean offerNext(N value) {
        return offer(lastAcceptedSlot + 1, value);
    }

    /**
     * Passes {@code error} to the error callback unless closed. A throwing callback is logged and ignored.
     */
    synchronized void report(Throwable error) {
        if (closed) {
            return;
        }
        try {
            onError.accept(error);
        } catch (RuntimeException e) {
            log.warn("[{}] error callback failed: {}", name, e.getMessage());
        }
    }

    /**
     * @return false when already closed
     */
    synchronized boolean close() {
        if (closed) {
            return false;
        }
        closed = true;
        return true;
    }

    synchronized boolean isClosed() {
        return closed;
    }

    synchronized long lastAcceptedSlot() {
        return lastAcceptedSlot;
    }
}
