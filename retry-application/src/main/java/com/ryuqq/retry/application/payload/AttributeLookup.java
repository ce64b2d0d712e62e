package com.ryuqq.retry.application.payload;

import java.util.Optional;

/**
 * 페이로드 속성 조회 결과.
 *
 * <ul>
 *   <li>{@link Found}: 속성이 존재함</li>
 *   <li>{@link NotFound}: 속성이 없음 (치명적인지는 호출자가 결정)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * // 없으면 핸들러 실패로 처리
 * String orderId = attributes.lookup("orderId").orElseThrow();
 *
 * // 없으면 기본값
 * String channel = attributes.lookup("channel").orElse("WEB");
 * </pre>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public sealed interface AttributeLookup permits AttributeLookup.Found, AttributeLookup.NotFound {

    /**
     * 조회한 속성 이름.
     *
     * @return 속성 이름
     */
    String key();

    /**
     * 속성 존재 여부.
     *
     * @return Found이면 true
     */
    default boolean isFound() {
        return this instanceof Found;
    }

    /**
     * 값 또는 기본값.
     *
     * @param fallback 없을 때 반환할 값
     * @return 값 또는 fallback
     */
    default String orElse(String fallback) {
        return this instanceof Found found ? found.value() : fallback;
    }

    /**
     * 값 또는 예외.
     *
     * @return 값
     * @throws AttributeNotFoundException 속성이 없는 경우
     */
    default String orElseThrow() {
        if (this instanceof Found found) {
            return found.value();
        }
        throw new AttributeNotFoundException(key());
    }

    /**
     * Optional로 변환.
     *
     * @return 값이 있으면 Optional.of(value)
     */
    default Optional<String> toOptional() {
        return this instanceof Found found ? Optional.of(found.value()) : Optional.empty();
    }

    /**
     * 속성 존재.
     *
     * @param key 속성 이름
     * @param value 문자열 값 (객체/배열은 JSON 문자열)
     */
    record Found(String key, String value) implements AttributeLookup {

        public Found {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("key cannot be null or blank");
            }
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }
    }

    /**
     * 속성 없음.
     *
     * @param key 속성 이름
     */
    record NotFound(String key) implements AttributeLookup {

        public NotFound {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("key cannot be null or blank");
            }
        }
    }
}
