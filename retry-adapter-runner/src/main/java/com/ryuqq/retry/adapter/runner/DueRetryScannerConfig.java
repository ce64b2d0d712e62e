package com.ryuqq.retry.adapter.runner;

/**
 * DueRetryScanner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms = 1분)</li>
 *   <li>batchSize: 한 번에 디스패치할 레코드 수 (기본 100)</li>
 * </ul>
 *
 * <p>재시도 간격은 분 단위이므로 scanIntervalMs를 1분보다 크게 잡으면
 * 그만큼 실제 재시도가 예정 시각보다 늦어질 수 있습니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record DueRetryScannerConfig(
    long scanIntervalMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=60000ms (1분), batchSize=100</p>
     */
    public DueRetryScannerConfig() {
        this(60000, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DueRetryScannerConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public DueRetryScannerConfig withScanIntervalMs(long scanIntervalMs) {
        return new DueRetryScannerConfig(scanIntervalMs, batchSize);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public DueRetryScannerConfig withBatchSize(int batchSize) {
        return new DueRetryScannerConfig(scanIntervalMs, batchSize);
    }
}
