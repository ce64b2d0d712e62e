package com.ryuqq.retry.core.spi;

import com.ryuqq.retry.core.model.FailureNotification;

import java.util.List;

/**
 * Ingestion SPI: how business logic and retry handlers report attempt outcomes.
 *
 * <p>Fire-and-forget, asynchronous, at-least-once. Publishing returns as soon as
 * the notification is accepted by the transport.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public interface NotificationPublisher {

    /**
     * Publishes one notification.
     *
     * @param notification the notification
     * @throws IllegalArgumentException if notification is null
     */
    void publish(FailureNotification notification);

    /**
     * Publishes several notifications.
     *
     * @param notifications the notifications
     * @throws IllegalArgumentException if notifications is null
     */
    default void publishAll(List<FailureNotification> notifications) {
        if (notifications == null) {
            throw new IllegalArgumentException("notifications cannot be null");
        }
        for (FailureNotification notification : notifications) {
            publish(notification);
        }
    }
}
