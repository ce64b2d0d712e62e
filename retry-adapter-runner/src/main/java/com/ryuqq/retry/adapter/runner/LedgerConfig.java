package com.ryuqq.retry.adapter.runner;

/**
 * ReconcilingRetryLedger 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enforceRetryLimit: retryCount가 maxRetryLimit에 도달하면 체인을 비활성화 (기본 true)</li>
 * </ul>
 *
 * <p>false로 두면 Ledger는 한도와 관계없이 체인을 계속 전진시키며,
 * 한도 검사는 외부 스케줄러의 몫이 됩니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 * @param enforceRetryLimit 재시도 한도 강제 여부
 */
public record LedgerConfig(boolean enforceRetryLimit) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: enforceRetryLimit=true</p>
     */
    public LedgerConfig() {
        this(true);
    }

    /**
     * enforceRetryLimit만 변경한 새 인스턴스 생성.
     */
    public LedgerConfig withEnforceRetryLimit(boolean enforceRetryLimit) {
        return new LedgerConfig(enforceRetryLimit);
    }
}
