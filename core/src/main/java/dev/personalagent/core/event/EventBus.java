package dev.personalagent.core.event;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded broadcast channel connecting the UI, the presenters and the domain
 * services.
 *
 * <p>
 * All subscribers read from one shared ring buffer of {@code capacity} slots,
 * each through its own cursor. Publishing never blocks: when a slow subscriber
 * falls more than {@code capacity} events behind, its oldest unread events are
 * overwritten and its next receive reports the gap with a
 * {@link SubscriberLaggedException}. Other subscribers are not affected.
 *
 * <p>
 * A subscriber only sees events published after it subscribed. Publishing
 * while nobody is subscribed fails with {@link NoSubscribersException} and the
 * event is dropped.
 */
public class EventBus implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);

    private final int capacity;
    private final AppEvent[] ring;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    // sequence number the next published event receives
    private long tail;
    private int subscriberCount;
    private boolean closed;

    public EventBus(int capacity) {
        Preconditions.checkArgument(capacity >= 1, "capacity must be at least 1, was %s", capacity);
        this.capacity = capacity;
        this.ring = new AppEvent[capacity];
    }

    // -- Public API --

    /**
     * Registers a new subscriber. It counts as live until it is closed.
     */
    public Subscriber subscribe() {
        lock.lock();
        try {
            subscriberCount++;
            return new Subscriber(tail);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends {@code event} for every live subscriber.
     *
     * @return the number of subscribers live at publish time
     * @throws NoSubscribersException if nobody is subscribed; the event is
     *                                discarded
     * @throws IllegalStateException  if the bus was closed
     */
    public int publish(AppEvent event) throws NoSubscribersException {
        Objects.requireNonNull(event, "event");
        int receivers;
        lock.lock();
        try {
            Preconditions.checkState(!closed, "Event bus is closed");
            if (subscriberCount == 0) {
                throw new NoSubscribersException(event);
            }
            ring[slot(tail)] = event;
            tail++;
            receivers = subscriberCount;
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        // Stream deltas arrive per token and would flood the log
        if (event instanceof ChatEvent.TextDelta || event instanceof ChatEvent.ThinkingDelta) {
            LOG.trace("Published {} to {} subscribers", event, receivers);
        } else {
            LOG.debug("Published {} to {} subscribers", event, receivers);
        }
        return receivers;
    }

    public int subscriberCount() {
        lock.lock();
        try {
            return subscriberCount;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the bus. Subscribers drain what is still buffered and then
     * receive {@link EventBusClosedException}. Further publishes fail.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        LOG.info("Event bus closed");
    }

    // -- Internal --

    private int slot(long sequence) {
        return (int) (sequence % capacity);
    }

    /**
     * Independent, ordered view over the bus. Not thread-safe: each subscriber
     * is meant to be drained by a single consumer.
     */
    public final class Subscriber implements AutoCloseable {

        private long cursor;
        private boolean unsubscribed;

        private Subscriber(long cursor) {
            this.cursor = cursor;
        }

        /**
         * Blocks until the next event is available.
         *
         * @throws SubscriberLaggedException if events were skipped; the next
         *                                   call resumes normally
         * @throws EventBusClosedException   if no further events will arrive
         */
        public AppEvent receive()
                throws SubscriberLaggedException, EventBusClosedException, InterruptedException {
            lock.lockInterruptibly();
            try {
                while (true) {
                    AppEvent next = next();
                    if (next != null) {
                        return next;
                    }
                    changed.await();
                }
            } finally {
                lock.unlock();
            }
        }

        /**
         * Like {@link #receive()} but gives up after {@code timeout}.
         *
         * @throws TimeoutException if nothing arrived in time
         */
        public AppEvent receive(Duration timeout) throws SubscriberLaggedException, EventBusClosedException,
                InterruptedException, TimeoutException {
            long remaining = timeout.toNanos();
            lock.lockInterruptibly();
            try {
                while (true) {
                    AppEvent next = next();
                    if (next != null) {
                        return next;
                    }
                    if (remaining <= 0) {
                        throw new TimeoutException("No event within " + timeout);
                    }
                    remaining = changed.awaitNanos(remaining);
                }
            } finally {
                lock.unlock();
            }
        }

        /**
         * Number of published events this subscriber has not read yet,
         * including any that were already overwritten.
         */
        public long pending() {
            lock.lock();
            try {
                return tail - cursor;
            } finally {
                lock.unlock();
            }
        }

        /**
         * Unsubscribes. Idempotent. A blocked {@link #receive()} on this
         * subscriber wakes up with {@link EventBusClosedException}.
         */
        @Override
        public void close() {
            lock.lock();
            try {
                if (unsubscribed) {
                    return;
                }
                unsubscribed = true;
                subscriberCount--;
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }

        // Must hold the lock. Returns null when nothing is available yet.
        private AppEvent next() throws SubscriberLaggedException, EventBusClosedException {
            if (unsubscribed) {
                throw new EventBusClosedException();
            }
            long oldest = Math.max(0, tail - capacity);
            if (cursor < oldest) {
                long skipped = oldest - cursor;
                cursor = oldest;
                throw new SubscriberLaggedException(skipped);
            }
            if (cursor < tail) {
                AppEvent event = ring[slot(cursor)];
                cursor++;
                return event;
            }
            if (closed) {
                throw new EventBusClosedException();
            }
            return null;
        }
    }
}
