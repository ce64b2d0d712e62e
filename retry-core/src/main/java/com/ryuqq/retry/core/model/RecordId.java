package com.ryuqq.retry.core.model;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 재시도 체인(Retry Log Record)의 고유 식별자.
 *
 * <p>하나의 논리적 실패 작업에 대한 모든 재시도 시도는 동일한 RecordId로 추적됩니다.
 * 알림(FailureNotification)에 RecordId가 있으면 기존 체인 갱신, 없으면 새 체인 생성을 의미합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public final class RecordId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    private final String value;

    private RecordId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RecordId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("RecordId length cannot exceed 255 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("RecordId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * RecordId 생성.
     *
     * @param value RecordId 값
     * @return RecordId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RecordId of(String value) {
        return new RecordId(value);
    }

    /**
     * 무작위 UUID 기반 RecordId 생성.
     *
     * @return 새 RecordId
     */
    public static RecordId random() {
        return new RecordId(UUID.randomUUID().toString());
    }

    /**
     * 알림 ID로부터 결정적으로 RecordId 생성.
     *
     * <p>같은 notificationId는 항상 같은 RecordId로 매핑됩니다.
     * 새 체인 알림이 재전달되더라도 두 번째 체인이 생기지 않습니다.</p>
     *
     * @param notificationId 알림 ID
     * @return 파생된 RecordId
     * @throws IllegalArgumentException notificationId가 null이거나 빈 문자열인 경우
     */
    public static RecordId derivedFrom(String notificationId) {
        if (notificationId == null || notificationId.isBlank()) {
            throw new IllegalArgumentException("notificationId cannot be null or blank");
        }
        UUID uuid = UUID.nameUUIDFromBytes(notificationId.getBytes(StandardCharsets.UTF_8));
        return new RecordId(uuid.toString());
    }

    /**
     * RecordId 값 조회.
     *
     * @return RecordId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordId recordId = (RecordId) o;
        return value.equals(recordId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RecordId{" + value + '}';
    }
}
