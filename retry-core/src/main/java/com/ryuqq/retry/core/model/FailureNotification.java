package com.ryuqq.retry.core.model;

import java.util.UUID;

/**
 * 업무 로직 또는 재시도 핸들러가 발행하는 시도 결과 알림.
 *
 * <p>Retry Ledger가 배치 단위로 소비하며, 하나의 RetryLogRecord로 조정(reconcile)됩니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>notificationId:</strong> 전달 식별자. 전송 계층의 재전달 시에도 유지됩니다.</li>
 *   <li><strong>recordId:</strong> null이면 새 체인, 있으면 기존 체인 갱신</li>
 *   <li><strong>processed:</strong> true이면 종료 상태 (더 이상 재시도 고려 안 함)</li>
 *   <li><strong>requestPayload / responsePayload:</strong> 불투명 문자열 (보통 JSON)</li>
 *   <li><strong>overrides:</strong> 새 체인 생성 시에만 적용되는 정책 오버라이드</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * // 최초 실패: 새 체인
 * FailureNotification first = FailureNotification.failure("OrderSync", "push", request, response, "timeout");
 *
 * // 재시도 실패: 기존 체인
 * FailureNotification next = FailureNotification.failure("OrderSync", "push", request, response, "timeout")
 *     .withRecordId(record.recordId());
 *
 * // 재시도 성공: 체인 종료
 * FailureNotification done = FailureNotification.success("OrderSync", "push", request, response)
 *     .withRecordId(record.recordId())
 *     .asProcessed();
 * </pre>
 *
 * @param notificationId 알림 전달 식별자
 * @param recordId 대상 체인 ID (null이면 새 체인)
 * @param processName 프로세스 이름
 * @param methodName 메서드 이름 (null 가능)
 * @param status 시도 결과
 * @param processed 종료 여부
 * @param requestPayload 요청 페이로드 (null 가능)
 * @param responsePayload 응답 페이로드 (null 가능)
 * @param errorMessage 오류 메시지 (null 가능)
 * @param overrides 정책 오버라이드 (null이면 없음으로 대체)
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public record FailureNotification(
    String notificationId,
    RecordId recordId,
    String processName,
    String methodName,
    NotificationStatus status,
    boolean processed,
    String requestPayload,
    String responsePayload,
    String errorMessage,
    RetryOverrides overrides
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public FailureNotification {
        if (notificationId == null || notificationId.isBlank()) {
            throw new IllegalArgumentException("notificationId cannot be null or blank");
        }
        if (processName == null || processName.isBlank()) {
            throw new IllegalArgumentException("processName cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (overrides == null) {
            overrides = RetryOverrides.none();
        }
    }

    /**
     * 실패 알림 생성 (새 체인, 미처리).
     *
     * @param processName 프로세스 이름
     * @param methodName 메서드 이름 (null 가능)
     * @param requestPayload 요청 페이로드
     * @param responsePayload 응답 페이로드
     * @param errorMessage 오류 메시지
     * @return FailureNotification 인스턴스
     */
    public static FailureNotification failure(String processName, String methodName,
                                              String requestPayload, String responsePayload,
                                              String errorMessage) {
        return new FailureNotification(newNotificationId(), null, processName, methodName,
            NotificationStatus.FAILURE, false, requestPayload, responsePayload, errorMessage,
            RetryOverrides.none());
    }

    /**
     * 성공 알림 생성 (새 체인, 미처리).
     *
     * @param processName 프로세스 이름
     * @param methodName 메서드 이름 (null 가능)
     * @param requestPayload 요청 페이로드
     * @param responsePayload 응답 페이로드
     * @return FailureNotification 인스턴스
     */
    public static FailureNotification success(String processName, String methodName,
                                              String requestPayload, String responsePayload) {
        return new FailureNotification(newNotificationId(), null, processName, methodName,
            NotificationStatus.SUCCESS, false, requestPayload, responsePayload, null,
            RetryOverrides.none());
    }

    /**
     * 새 체인 알림인지 확인.
     *
     * @return recordId가 없으면 true
     */
    public boolean isNewChain() {
        return recordId == null;
    }

    public FailureNotification withRecordId(RecordId recordId) {
        return new FailureNotification(notificationId, recordId, processName, methodName, status,
            processed, requestPayload, responsePayload, errorMessage, overrides);
    }

    public FailureNotification withNotificationId(String notificationId) {
        return new FailureNotification(notificationId, recordId, processName, methodName, status,
            processed, requestPayload, responsePayload, errorMessage, overrides);
    }

    public FailureNotification withOverrides(RetryOverrides overrides) {
        return new FailureNotification(notificationId, recordId, processName, methodName, status,
            processed, requestPayload, responsePayload, errorMessage, overrides);
    }

    public FailureNotification withErrorMessage(String errorMessage) {
        return new FailureNotification(notificationId, recordId, processName, methodName, status,
            processed, requestPayload, responsePayload, errorMessage, overrides);
    }

    /**
     * processed=true인 사본 생성.
     *
     * @return 종료 상태 알림
     */
    public FailureNotification asProcessed() {
        return new FailureNotification(notificationId, recordId, processName, methodName, status,
            true, requestPayload, responsePayload, errorMessage, overrides);
    }

    private static String newNotificationId() {
        return UUID.randomUUID().toString();
    }
}
