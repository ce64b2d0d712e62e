package com.ryuqq.retry.adapter.runner;

/**
 * NotificationConsumer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: 한 번에 꺼내어 하나의 배치로 조정할 알림 수 (기본 100)</li>
 * </ul>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record NotificationConsumerConfig(int batchSize) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: batchSize=100</p>
     */
    public NotificationConsumerConfig() {
        this(100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException batchSize가 1 미만인 경우
     */
    public NotificationConsumerConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public NotificationConsumerConfig withBatchSize(int batchSize) {
        return new NotificationConsumerConfig(batchSize);
    }
}
