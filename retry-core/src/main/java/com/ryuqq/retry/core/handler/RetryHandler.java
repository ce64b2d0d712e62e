package com.ryuqq.retry.core.handler;

import com.ryuqq.retry.core.model.RetryLogRecord;

/**
 * 재시도 가능한 업무 로직이 구현하는 핸들러 계약.
 *
 * <p>Dispatch Gateway가 예정 시각이 된 체인을 발견하면, 체인의 processName으로 등록된
 * 핸들러를 찾아 {@link #invokeRetry(RetryLogRecord)}를 호출합니다.</p>
 *
 * <p><strong>결과 보고:</strong></p>
 * <ul>
 *   <li>반환값은 프레임워크가 검사하지 않습니다.</li>
 *   <li>성공/실패는 핸들러가 직접 {@code NotificationPublisher}로 알림을 발행해 보고합니다.</li>
 *   <li>던져진 예외는 Dispatch Gateway가 로그로 남기고 삼킵니다.</li>
 * </ul>
 *
 * <p><strong>멱등성:</strong> 스케줄러 패스가 겹치면 같은 체인이 두 번 디스패치될 수 있으므로
 * 구현체는 중복 호출을 견딜 수 있어야 합니다.</p>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * public void invokeRetry(RetryLogRecord record) {
 *     try {
 *         client.push(record.requestPayload());
 *         publisher.publish(FailureNotification.success("OrderSync", record.methodName(),
 *                 record.requestPayload(), "ok")
 *             .withRecordId(record.recordId())
 *             .asProcessed());
 *     } catch (IOException e) {
 *         publisher.publish(FailureNotification.failure("OrderSync", record.methodName(),
 *                 record.requestPayload(), null, e.getMessage())
 *             .withRecordId(record.recordId()));
 *     }
 * }
 * </pre>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryHandler {

    /**
     * 원본 작업 재실행.
     *
     * @param record 재시도 대상 체인
     */
    void invokeRetry(RetryLogRecord record);
}
