package com.ryuqq.retry.core.spi;

import com.ryuqq.retry.core.model.FailureNotification;

import java.util.List;

/**
 * Event transport SPI delivering notifications to the ledger consumer.
 *
 * <p><strong>Delivery Semantics:</strong></p>
 * <ul>
 *   <li>At-least-once: a notification may be delivered more than once</li>
 *   <li>Unordered across batches</li>
 *   <li>Redelivery keeps the original {@link FailureNotification#notificationId()}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * List&lt;FailureNotification&gt; batch = bus.dequeue(50);
 * ReconcileResult result = ledger.reconcile(batch);
 * if (result.isReconciled()) {
 *     batch.forEach(bus::ack);
 * } else {
 *     batch.forEach(bus::nack);
 * }
 * </pre>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public interface NotificationBus extends NotificationPublisher {

    /**
     * Dequeues up to {@code batchSize} notifications and marks them in flight.
     *
     * @param batchSize maximum number of notifications
     * @return dequeued notifications (may be empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<FailureNotification> dequeue(int batchSize);

    /**
     * Acknowledges a processed notification. Idempotent.
     *
     * @param notification the notification
     * @throws IllegalArgumentException if notification is null
     */
    void ack(FailureNotification notification);

    /**
     * Returns an in-flight notification to the queue for redelivery. Idempotent.
     *
     * @param notification the notification
     * @throws IllegalArgumentException if notification is null
     */
    void nack(FailureNotification notification);
}
