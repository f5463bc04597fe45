package dev.personalagent.presentation.deferred;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Holds at most one pending operation that must run outside the toolkit
 * callback which requested it. A new request replaces an unconsumed one: only
 * the latest intent matters.
 *
 * @param <T> operation descriptor
 */
public class DeferredOperationQueue<T> {

    private final AtomicReference<T> slot = new AtomicReference<>();

    /**
     * Stores {@code operation} for the next {@link #drainAndApply} without
     * running it.
     */
    public void request(T operation) {
        slot.set(Objects.requireNonNull(operation, "operation"));
    }

    /**
     * Takes the pending operation, if any, and runs it exactly once. Call once
     * per frame after the toolkit's callbacks have returned.
     *
     * @return {@code true} if an operation was applied
     */
    public boolean drainAndApply(Consumer<? super T> applier) {
        T operation = slot.getAndSet(null);
        if (operation == null) {
            return false;
        }
        applier.accept(operation);
        return true;
    }

    public Optional<T> peek() {
        return Optional.ofNullable(slot.get());
    }

    public boolean hasPending() {
        return slot.get() != null;
    }
}
