package com.ryuqq.retry.application.dispatch;

import com.ryuqq.retry.core.model.RecordId;

/**
 * Dispatch Gateway: 예정 시각이 된 체인의 핸들러를 찾아 재실행합니다.
 *
 * <p>외부 스케줄러가 {@code retryEnabled == true && retryDueAt <= now}인 레코드에 대해서만 호출합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. logId로 RetryLogRecord 조회
 * 2. processName으로 등록된 RetryHandler 조회
 * 3. handler.invokeRetry(record)
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>조회/호출 중 발생한 모든 예외는 로그로 남기고 삼킵니다 (스케줄러로 전파하지 않음)</li>
 *   <li>Ledger 상태를 전진/후퇴시키지 않습니다</li>
 *   <li>성공/실패 판단은 핸들러가 발행하는 새 알림으로 이루어집니다</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 블로킹 동기 호출이며 Ledger와 공유하는 락을 잡지 않습니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public interface DispatchGateway {

    /**
     * 재시도 실행.
     *
     * @param logId 체인 ID
     * @param processName 핸들러 조회용 프로세스 이름
     */
    void executeRetry(RecordId logId, String processName);
}
