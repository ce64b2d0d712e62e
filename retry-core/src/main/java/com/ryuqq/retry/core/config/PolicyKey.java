package com.ryuqq.retry.core.config;

/**
 * 재시도 정책 조회 키 생성 유틸리티.
 *
 * <p><strong>키 규칙:</strong></p>
 * <pre>
 * methodName이 비어있음  → "OrderSync"
 * methodName이 있음      → "OrderSync--push"
 * </pre>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public final class PolicyKey {

    /**
     * 프로세스 이름과 메서드 이름 사이의 구분자.
     */
    public static final String SEPARATOR = "--";

    private PolicyKey() {
    }

    /**
     * 조회 키 생성.
     *
     * @param processName 프로세스 이름
     * @param methodName 메서드 이름 (null 또는 빈 문자열 가능)
     * @return 조회 키
     * @throws IllegalArgumentException processName이 null이거나 빈 문자열인 경우
     */
    public static String of(String processName, String methodName) {
        if (processName == null || processName.isBlank()) {
            throw new IllegalArgumentException("processName cannot be null or blank");
        }
        if (methodName == null || methodName.isBlank()) {
            return processName;
        }
        return processName + SEPARATOR + methodName;
    }
}
