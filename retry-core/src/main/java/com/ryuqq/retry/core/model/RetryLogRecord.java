package com.ryuqq.retry.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 재시도 체인 하나의 영속 상태.
 *
 * <p>체인당 하나씩 존재하며 {@link RecordId}로 식별됩니다. 첫 알림으로 생성되고,
 * 같은 recordId를 가진 후속 알림으로 갱신됩니다 (중복 생성되지 않음).</p>
 *
 * <p><strong>스케줄링 필드:</strong></p>
 * <ul>
 *   <li><strong>retryEnabled:</strong> 활성 정책 존재 + FAILURE + 미처리일 때만 true</li>
 *   <li><strong>retryCount:</strong> 체인이 연장될 때마다 1씩 증가 (감소하지 않음)</li>
 *   <li><strong>retryDueAt:</strong> 다음 재시도 예정 시각 (감소하지 않음, 미스케줄이면 null)</li>
 *   <li><strong>retryIntervalMinutes / maxRetryLimit:</strong> 체인 생성 시 결정되어 이후 유지 (미스케줄이면 null)</li>
 * </ul>
 *
 * <p><strong>스케줄러 조회 조건:</strong></p>
 * <pre>
 * WHERE retry_enabled = true
 *   AND processed = false
 *   AND retry_due_at &lt;= now
 * </pre>
 *
 * @param recordId 체인 ID
 * @param processName 프로세스 이름
 * @param methodName 메서드 이름 (null 가능)
 * @param status 마지막 시도 결과
 * @param processed 종료 여부
 * @param requestPayload 요청 페이로드
 * @param responsePayload 응답 페이로드
 * @param errorMessage 오류 메시지
 * @param retryEnabled 재시도 대상 여부
 * @param retryIntervalMinutes 재시도 간격 (분, null 가능)
 * @param maxRetryLimit 최대 재시도 횟수 (null 가능)
 * @param retryCount 재시도 카운트 (0 이상)
 * @param retryDueAt 다음 재시도 예정 시각 (null 가능)
 * @param appliedNotificationIds 이 체인에 반영된 알림 ID (오래된 순, 최근 {@value #MAX_APPLIED_NOTIFICATION_IDS}개까지)
 * @param updatedAt 마지막 조정 시각
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public record RetryLogRecord(
    RecordId recordId,
    String processName,
    String methodName,
    NotificationStatus status,
    boolean processed,
    String requestPayload,
    String responsePayload,
    String errorMessage,
    boolean retryEnabled,
    Integer retryIntervalMinutes,
    Integer maxRetryLimit,
    int retryCount,
    Instant retryDueAt,
    List<String> appliedNotificationIds,
    Instant updatedAt
) {

    /**
     * 레코드당 보관하는 반영 알림 ID 최대 개수.
     */
    public static final int MAX_APPLIED_NOTIFICATION_IDS = 64;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 카운트가 음수인 경우
     */
    public RetryLogRecord {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        if (processName == null || processName.isBlank()) {
            throw new IllegalArgumentException("processName cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }
        if (retryEnabled && retryDueAt == null) {
            throw new IllegalArgumentException("retryDueAt cannot be null when retryEnabled is true");
        }
        appliedNotificationIds = boundedIds(appliedNotificationIds);
    }

    /**
     * 마지막으로 반영된 알림 ID.
     *
     * @return 가장 최근 알림 ID (반영된 알림이 없으면 null)
     */
    public String lastNotificationId() {
        return appliedNotificationIds.isEmpty()
            ? null
            : appliedNotificationIds.get(appliedNotificationIds.size() - 1);
    }

    /**
     * 주어진 알림이 이미 이 체인에 반영되었는지 확인.
     *
     * @param notificationId 알림 ID
     * @return 보관 중인 반영 ID에 포함되면 true
     */
    public boolean hasApplied(String notificationId) {
        return appliedNotificationIds.contains(notificationId);
    }

    /**
     * 기존 반영 ID 뒤에 새 ID를 이어 붙인 목록 생성 (중복 제외, 최근 것만 유지).
     *
     * @param applied 기존 반영 ID
     * @param added 새로 반영된 ID
     * @return 최근 {@value #MAX_APPLIED_NOTIFICATION_IDS}개 이하의 목록
     */
    public static List<String> appendApplied(List<String> applied, List<String> added) {
        List<String> merged = new ArrayList<>(applied);
        for (String id : added) {
            if (!merged.contains(id)) {
                merged.add(id);
            }
        }
        return boundedIds(merged);
    }

    private static List<String> boundedIds(List<String> ids) {
        if (ids == null) {
            return List.of();
        }
        for (String id : ids) {
            if (id == null) {
                throw new IllegalArgumentException("appliedNotificationIds cannot contain null");
            }
        }
        int from = Math.max(0, ids.size() - MAX_APPLIED_NOTIFICATION_IDS);
        return List.copyOf(ids.subList(from, ids.size()));
    }

    /**
     * 주어진 시각 기준으로 재시도 실행 대상인지 확인.
     *
     * @param now 기준 시각
     * @return retryEnabled이고 미처리이며 예정 시각이 지났으면 true
     */
    public boolean isDue(Instant now) {
        return retryEnabled && !processed && retryDueAt != null && !retryDueAt.isAfter(now);
    }

    /**
     * 재시도 한도 도달 여부.
     *
     * @return maxRetryLimit이 있고 retryCount가 그 이상이면 true
     */
    public boolean isExhausted() {
        return maxRetryLimit != null && retryCount >= maxRetryLimit;
    }

    /**
     * 스케줄이 한 번이라도 잡힌 체인인지 확인.
     *
     * @return retryDueAt이 있으면 true
     */
    public boolean isScheduled() {
        return retryDueAt != null;
    }
}
