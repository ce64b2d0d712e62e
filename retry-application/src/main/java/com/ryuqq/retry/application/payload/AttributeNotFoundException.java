package com.ryuqq.retry.application.payload;

/**
 * 핸들러가 필수로 요구한 속성이 페이로드에 없을 때 발생.
 *
 * <p>프레임워크는 이 예외를 삼키지 않고 호출한 핸들러로 그대로 전달합니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public class AttributeNotFoundException extends RuntimeException {

    private final String key;

    public AttributeNotFoundException(String key) {
        super("Attribute not found in payload: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
