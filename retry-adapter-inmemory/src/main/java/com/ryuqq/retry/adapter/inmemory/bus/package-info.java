/**
 * In-memory notification bus for testing and reference.
 *
 * <h2>Notification Lifecycle</h2>
 *
 * <pre>
 * publish ─► queue ─► dequeue ─► in-flight
 *                                   │
 *                                   ├──► ack() ─────────────────► [Removed]
 *                                   ├──► nack() ────────────────► [Re-queued]
 *                                   └──► Visibility Timeout ────► [Re-queued]
 * </pre>
 *
 * <p>Redelivered notifications keep their notificationId, which is what lets the ledger
 * skip a batch it has already applied.</p>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li><strong>In-Memory Only:</strong> Data lost on process restart</li>
 *   <li><strong>Manual Timeout Processing:</strong> Requires explicit {@code processVisibilityTimeouts()} calls</li>
 * </ul>
 *
 * @see com.ryuqq.retry.core.spi.NotificationBus
 * @author Retry Ledger Team
 * @since 1.0.0
 */
package com.ryuqq.retry.adapter.inmemory.bus;
