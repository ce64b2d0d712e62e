package com.ryuqq.retry.application.runtime;

/**
 * Notification consumer runtime.
 *
 * <p>This interface defines one polling cycle of the notification consumer that feeds
 * the Retry Ledger from the event transport.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump()
 *   1. Dequeue a batch of notifications from the NotificationBus
 *   2. ledger.reconcile(batch)
 *   3. Reconciled   → ack every notification
 *      Unreconciled → nack every notification (transport redelivery)
 * </pre>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * {@literal @Scheduled}(fixedDelay = 100)
 * public void scheduledPump() {
 *     runtime.pump();
 * }
 * </pre>
 *
 * <p><strong>Processing Guarantees:</strong></p>
 * <ul>
 *   <li>At-least-once: notifications may be reconciled more than once</li>
 *   <li>Batch atomicity: a batch is either fully reconciled or fully returned to the transport</li>
 *   <li>Caller is responsible for continuous invocation (loop or scheduler)</li>
 * </ul>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single pump cycle: dequeue, reconcile, acknowledge.
     *
     * @return number of notifications dequeued in this cycle
     * @throws RuntimeException if critical infrastructure fails (bus unavailable, policy table unreadable)
     */
    int pump();
}
