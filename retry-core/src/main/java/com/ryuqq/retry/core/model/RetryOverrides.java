package com.ryuqq.retry.core.model;

/**
 * 알림 단위로 정책 값을 덮어쓰는 선택적 오버라이드.
 *
 * <p>각 값은 null이면 "오버라이드 없음"이며, 지정된 경우 새 체인 생성 시에만
 * 해석된 정책 값 대신 사용됩니다. 기존 체인 갱신 시에는 무시됩니다.</p>
 *
 * @param retryIntervalMinutes 재시도 간격 (분, null 가능)
 * @param maxRetryLimit 최대 재시도 횟수 (null 가능)
 * @param retryCount 초기 재시도 카운트 (null 가능)
 * @param startFirstRetryAfterMinutes 최초 재시도 지연 (분, null 가능)
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public record RetryOverrides(
    Integer retryIntervalMinutes,
    Integer maxRetryLimit,
    Integer retryCount,
    Integer startFirstRetryAfterMinutes
) {

    private static final RetryOverrides NONE = new RetryOverrides(null, null, null, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 지정된 값이 음수인 경우
     */
    public RetryOverrides {
        requireNonNegative("retryIntervalMinutes", retryIntervalMinutes);
        requireNonNegative("maxRetryLimit", maxRetryLimit);
        requireNonNegative("retryCount", retryCount);
        requireNonNegative("startFirstRetryAfterMinutes", startFirstRetryAfterMinutes);
    }

    /**
     * 오버라이드 없음.
     *
     * @return 모든 값이 null인 인스턴스
     */
    public static RetryOverrides none() {
        return NONE;
    }

    /**
     * 오버라이드가 하나도 없는지 확인.
     *
     * @return 모든 값이 null이면 true
     */
    public boolean isEmpty() {
        return retryIntervalMinutes == null && maxRetryLimit == null
            && retryCount == null && startFirstRetryAfterMinutes == null;
    }

    public RetryOverrides withRetryIntervalMinutes(Integer retryIntervalMinutes) {
        return new RetryOverrides(retryIntervalMinutes, maxRetryLimit, retryCount, startFirstRetryAfterMinutes);
    }

    public RetryOverrides withMaxRetryLimit(Integer maxRetryLimit) {
        return new RetryOverrides(retryIntervalMinutes, maxRetryLimit, retryCount, startFirstRetryAfterMinutes);
    }

    public RetryOverrides withRetryCount(Integer retryCount) {
        return new RetryOverrides(retryIntervalMinutes, maxRetryLimit, retryCount, startFirstRetryAfterMinutes);
    }

    public RetryOverrides withStartFirstRetryAfterMinutes(Integer startFirstRetryAfterMinutes) {
        return new RetryOverrides(retryIntervalMinutes, maxRetryLimit, retryCount, startFirstRetryAfterMinutes);
    }

    private static void requireNonNegative(String name, Integer value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException(name + " must be non-negative (current: " + value + ")");
        }
    }
}
