package com.ryuqq.retry.adapter.inmemory.bus;

import com.ryuqq.retry.core.model.FailureNotification;
import com.ryuqq.retry.core.spi.NotificationBus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In-memory implementation of {@link NotificationBus} SPI for testing and reference purposes.
 *
 * <p>Notifications are delivered in publish order. A dequeued notification stays in flight,
 * keyed by its notificationId, until it is acknowledged, negatively acknowledged,
 * or its visibility timeout expires.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Main Queue:</strong> LinkedBlockingQueue&lt;FailureNotification&gt; - FIFO delivery</li>
 *   <li><strong>In-Flight Tracking:</strong> ConcurrentHashMap&lt;String, InFlight&gt; - Visibility timeout management</li>
 * </ul>
 *
 * <p><strong>Delivery Semantics:</strong> at-least-once. A notification returned by
 * {@link #nack(FailureNotification)} or by an expired visibility timeout is delivered again
 * with the same notificationId.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * NotificationBus bus = new InMemoryNotificationBus();
 * bus.publish(FailureNotification.failure("ORDER", "charge", req, resp, "timeout"));
 *
 * List&lt;FailureNotification&gt; batch = bus.dequeue(100);
 * ReconcileResult result = ledger.reconcile(batch);
 * batch.forEach(result.isReconciled() ? bus::ack : bus::nack);
 * </pre>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public class InMemoryNotificationBus implements NotificationBus {

    /**
     * Default visibility timeout: 30 seconds.
     */
    private static final long DEFAULT_VISIBILITY_TIMEOUT_MS = 30_000L;

    private final LinkedBlockingQueue<FailureNotification> queue;
    private final ConcurrentHashMap<String, InFlight> inFlight;
    private final long visibilityTimeoutMs;

    /**
     * Creates a new InMemoryNotificationBus with default visibility timeout (30 seconds).
     */
    public InMemoryNotificationBus() {
        this(DEFAULT_VISIBILITY_TIMEOUT_MS);
    }

    /**
     * Creates a new InMemoryNotificationBus with custom visibility timeout.
     *
     * @param visibilityTimeoutMs visibility timeout in milliseconds
     * @throws IllegalArgumentException if visibilityTimeoutMs is not positive
     */
    public InMemoryNotificationBus(long visibilityTimeoutMs) {
        if (visibilityTimeoutMs <= 0) {
            throw new IllegalArgumentException("visibilityTimeoutMs must be positive, but was: " + visibilityTimeoutMs);
        }

        this.queue = new LinkedBlockingQueue<>();
        this.inFlight = new ConcurrentHashMap<>();
        this.visibilityTimeoutMs = visibilityTimeoutMs;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void publish(FailureNotification notification) {
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }

        queue.add(notification);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Polls up to batchSize notifications in publish order</li>
     *   <li>Visibility timeout starts immediately upon dequeue</li>
     *   <li>Returns empty list if no notifications available</li>
     * </ul>
     */
    @Override
    public List<FailureNotification> dequeue(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        List<FailureNotification> result = new ArrayList<>();
        long deadline = System.currentTimeMillis() + visibilityTimeoutMs;

        for (int i = 0; i < batchSize; i++) {
            FailureNotification notification = queue.poll();
            if (notification == null) {
                break;
            }

            inFlight.put(notification.notificationId(), new InFlight(notification, deadline));
            result.add(notification);
        }

        return result;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void ack(FailureNotification notification) {
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }

        inFlight.remove(notification.notificationId());
    }

    /**
     * {@inheritDoc}
     *
     * <p>Only an in-flight notification is re-queued, so a second nack is a no-op.</p>
     */
    @Override
    public void nack(FailureNotification notification) {
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }

        InFlight entry = inFlight.remove(notification.notificationId());
        if (entry != null) {
            queue.add(entry.notification);
        }
    }

    /**
     * Returns in-flight notifications whose visibility timeout has passed to the queue.
     *
     * @return number of notifications returned to queue
     */
    public int processVisibilityTimeouts() {
        long now = System.currentTimeMillis();
        int count = 0;

        List<String> expired = new ArrayList<>();
        for (Map.Entry<String, InFlight> entry : inFlight.entrySet()) {
            if (entry.getValue().deadline <= now) {
                expired.add(entry.getKey());
            }
        }

        for (String notificationId : expired) {
            InFlight entry = inFlight.remove(notificationId);
            if (entry != null) {
                queue.add(entry.notification);
                count++;
            }
        }

        return count;
    }

    /**
     * Manually triggers visibility timeout for a specific notification. Used for testing.
     *
     * <p>The notification stays unacknowledged from the consumer's point of view and is
     * delivered again, which is how a lost ack looks to the ledger.</p>
     *
     * @param notification the notification to expire
     * @return true if the notification was in-flight and expired, false otherwise
     * @throws IllegalArgumentException if notification is null
     */
    public boolean expireVisibilityTimeout(FailureNotification notification) {
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }

        InFlight entry = inFlight.remove(notification.notificationId());
        if (entry != null) {
            queue.add(entry.notification);
            return true;
        }
        return false;
    }

    /**
     * Clears queue and in-flight tracking. Used for test cleanup.
     */
    public void clear() {
        queue.clear();
        inFlight.clear();
    }

    /**
     * Returns the number of queued notifications (not in-flight). Used for test assertions.
     *
     * @return queue size
     */
    public int queueSize() {
        return queue.size();
    }

    /**
     * Returns the number of in-flight notifications. Used for test assertions.
     *
     * @return in-flight count
     */
    public int inFlightSize() {
        return inFlight.size();
    }

    private static final class InFlight {
        private final FailureNotification notification;
        private final long deadline;

        InFlight(FailureNotification notification, long deadline) {
            this.notification = notification;
            this.deadline = deadline;
        }
    }
}
