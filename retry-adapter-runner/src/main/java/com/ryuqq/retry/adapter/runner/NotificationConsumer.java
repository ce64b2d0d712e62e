package com.ryuqq.retry.adapter.runner;

import com.ryuqq.retry.application.ledger.ReconcileResult;
import com.ryuqq.retry.application.ledger.RetryLedger;
import com.ryuqq.retry.application.runtime.Runtime;
import com.ryuqq.retry.core.model.FailureNotification;
import com.ryuqq.retry.core.spi.NotificationBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 알림 버스에서 배치를 꺼내 Ledger로 조정하는 Runtime 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * dequeue(batchSize) → [n1, n2, ...]
 *   ↓
 * ledger.reconcile(batch) → 하나의 배치로 조정
 *   ↓
 * Reconciled   → 전체 ACK
 * Unreconciled → 전체 NACK (전송 계층 재전달이 유일한 복구 경로)
 * 예외         → 전체 NACK 후 예외 전파
 * </pre>
 *
 * <p>재전달된 알림은 같은 notificationId를 가지므로 이미 적용된 알림은 Ledger가 건너뜁니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public final class NotificationConsumer implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(NotificationConsumer.class);

    private final NotificationBus bus;
    private final RetryLedger ledger;
    private final NotificationConsumerConfig config;

    /**
     * 생성자.
     *
     * @param bus 알림 버스
     * @param ledger 재시도 Ledger
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public NotificationConsumer(NotificationBus bus, RetryLedger ledger, NotificationConsumerConfig config) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.bus = bus;
        this.ledger = ledger;
        this.config = config;
    }

    @Override
    public int pump() {
        // 1. 배치 dequeue
        List<FailureNotification> batch = bus.dequeue(config.batchSize());
        if (batch.isEmpty()) {
            return 0;
        }

        // 2. 배치 조정
        ReconcileResult result;
        try {
            result = ledger.reconcile(batch);
        } catch (RuntimeException e) {
            batch.forEach(bus::nack);
            log.error("Reconciliation threw for batch of {}; returned to bus", batch.size(), e);
            throw e;
        }

        // 3. ACK / NACK
        if (result.isReconciled()) {
            batch.forEach(bus::ack);
        } else {
            batch.forEach(bus::nack);
            log.warn("Batch of {} left unreconciled and returned to bus: {}",
                batch.size(), ((ReconcileResult.Unreconciled) result).reason());
        }
        return batch.size();
    }
}
