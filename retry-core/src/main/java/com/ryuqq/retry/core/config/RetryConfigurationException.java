package com.ryuqq.retry.core.config;

/**
 * 재시도 설정이 잘못되었거나 로드할 수 없을 때 발생하는 치명적 오류.
 *
 * <p>정책 캐시 재구성 실패, 중복 정책 키 등이 해당됩니다.
 * 정책이 없는 경우(조회 미스)는 오류가 아니며 이 예외를 사용하지 않습니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public class RetryConfigurationException extends RuntimeException {

    public RetryConfigurationException(String message) {
        super(message);
    }

    public RetryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
