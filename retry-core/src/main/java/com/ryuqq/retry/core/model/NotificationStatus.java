package com.ryuqq.retry.core.model;

/**
 * 원본 작업 또는 재시도 작업 1회 시도의 결과 상태.
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public enum NotificationStatus {

    /**
     * 시도가 성공함. 재시도 대상이 아닙니다.
     */
    SUCCESS,

    /**
     * 시도가 실패함. 정책이 있고 미처리 상태이면 재시도 대상이 됩니다.
     */
    FAILURE;

    /**
     * 실패 상태인지 확인.
     *
     * @return FAILURE이면 true
     */
    public boolean isFailure() {
        return this == FAILURE;
    }
}
