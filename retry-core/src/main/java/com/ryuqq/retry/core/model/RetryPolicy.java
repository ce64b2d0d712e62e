package com.ryuqq.retry.core.model;

import com.ryuqq.retry.core.config.PolicyKey;

/**
 * 프로세스(및 선택적으로 메서드) 단위의 재시도 정책.
 *
 * <p>설정 테이블의 한 행에 해당하며, 프로세스 시작 시 전체 로드되어 캐시됩니다.</p>
 *
 * <p><strong>키 구성:</strong></p>
 * <ul>
 *   <li>methodName이 비어있으면: {@code processName}</li>
 *   <li>methodName이 있으면: {@code processName--methodName}</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * // OrderSync 프로세스 전체: 최대 3회, 30분 간격, 최초 5분 후 시작
 * RetryPolicy.of("OrderSync", null, 3, 30, 5);
 *
 * // OrderSync의 push 메서드만 별도 정책
 * RetryPolicy.of("OrderSync", "push", 5, 10, 1);
 * </pre>
 *
 * @param processName 프로세스 이름 (필수)
 * @param methodName 메서드 이름 (선택, null 가능)
 * @param maxRetryCount 최대 재시도 횟수 (0 이상)
 * @param retryIntervalMinutes 재시도 간격 (분, 0 이상)
 * @param startFirstRetryAfterMinutes 최초 재시도까지 지연 (분, 0 이상)
 * @param active 활성 여부
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public record RetryPolicy(
    String processName,
    String methodName,
    int maxRetryCount,
    int retryIntervalMinutes,
    int startFirstRetryAfterMinutes,
    boolean active
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public RetryPolicy {
        if (processName == null || processName.isBlank()) {
            throw new IllegalArgumentException("processName cannot be null or blank");
        }
        if (maxRetryCount < 0) {
            throw new IllegalArgumentException("maxRetryCount must be non-negative (current: " + maxRetryCount + ")");
        }
        if (retryIntervalMinutes < 0) {
            throw new IllegalArgumentException("retryIntervalMinutes must be non-negative (current: " + retryIntervalMinutes + ")");
        }
        if (startFirstRetryAfterMinutes < 0) {
            throw new IllegalArgumentException("startFirstRetryAfterMinutes must be non-negative (current: " + startFirstRetryAfterMinutes + ")");
        }
    }

    /**
     * 활성 정책 생성.
     *
     * @param processName 프로세스 이름
     * @param methodName 메서드 이름 (null 가능)
     * @param maxRetryCount 최대 재시도 횟수
     * @param retryIntervalMinutes 재시도 간격 (분)
     * @param startFirstRetryAfterMinutes 최초 재시도 지연 (분)
     * @return RetryPolicy 인스턴스
     */
    public static RetryPolicy of(String processName, String methodName, int maxRetryCount,
                                 int retryIntervalMinutes, int startFirstRetryAfterMinutes) {
        return new RetryPolicy(processName, methodName, maxRetryCount, retryIntervalMinutes,
            startFirstRetryAfterMinutes, true);
    }

    /**
     * 이 정책의 조회 키.
     *
     * @return {@code processName} 또는 {@code processName--methodName}
     */
    public String key() {
        return PolicyKey.of(processName, methodName);
    }

    /**
     * 메서드 수준 정책인지 확인.
     *
     * @return methodName이 지정되어 있으면 true
     */
    public boolean isMethodLevel() {
        return methodName != null && !methodName.isBlank();
    }

    /**
     * 비활성화된 사본 생성.
     *
     * @return active=false인 새 인스턴스
     */
    public RetryPolicy deactivated() {
        return new RetryPolicy(processName, methodName, maxRetryCount, retryIntervalMinutes,
            startFirstRetryAfterMinutes, false);
    }
}
