package dev.personalagent.presentation.bridge;

import com.google.common.base.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO channel between the UI thread and the background side.
 * Sending never blocks: a full channel drops the new value. Only
 * {@link #receive()} blocks, and it is meant for background consumers.
 *
 * @param <T> message type
 */
public final class BridgeChannel<T> {

    private final int capacity;
    private final ArrayDeque<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private boolean closed;

    public BridgeChannel(int capacity) {
        Preconditions.checkArgument(capacity >= 1, "capacity must be at least 1, was %s", capacity);
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public SendResult trySend(T value) {
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            if (closed) {
                return SendResult.CLOSED;
            }
            if (queue.size() >= capacity) {
                return SendResult.FULL;
            }
            queue.addLast(value);
            notEmpty.signal();
            return SendResult.SENT;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns everything queued, oldest first. Never blocks.
     */
    public List<T> drain() {
        lock.lock();
        try {
            if (queue.isEmpty()) {
                return List.of();
            }
            List<T> drained = new ArrayList<>(queue);
            queue.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a value is available. Returns empty once the channel is
     * closed and nothing is left to deliver.
     */
    public Optional<T> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !closed) {
                notEmpty.await();
            }
            return Optional.ofNullable(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return queue.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Rejects further sends. Values already queued can still be received.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
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
}
