package com.ryuqq.retry.core.handler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * processName → {@link RetryHandler} 명시적 레지스트리.
 *
 * <p>애플리케이션 시작 시 한 번 구성되는 불변 맵이며, 정확한 문자열 일치로 조회합니다.
 * 등록되지 않은 이름은 런타임 타입 오류가 아니라 보고 가능한 설정 오류
 * ({@link HandlerNotRegisteredException})입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * HandlerRegistry registry = HandlerRegistry.builder()
 *     .register("OrderSync", orderSyncHandler)
 *     .register("InvoicePush", invoicePushHandler)
 *     .build();
 *
 * registry.require("OrderSync").invokeRetry(record);
 * </pre>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public final class HandlerRegistry {

    private final Map<String, RetryHandler> handlers;

    private HandlerRegistry(Map<String, RetryHandler> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    /**
     * 빌더 생성.
     *
     * @return 새 빌더
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 핸들러 조회.
     *
     * @param processName 프로세스 이름
     * @return 등록된 핸들러, 없으면 empty
     */
    public Optional<RetryHandler> find(String processName) {
        if (processName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(processName));
    }

    /**
     * 핸들러 조회 (필수).
     *
     * @param processName 프로세스 이름
     * @return 등록된 핸들러
     * @throws HandlerNotRegisteredException 등록되지 않은 경우
     */
    public RetryHandler require(String processName) {
        return find(processName)
            .orElseThrow(() -> new HandlerNotRegisteredException(processName));
    }

    /**
     * 등록된 프로세스 이름 목록.
     *
     * @return 불변 Set
     */
    public Set<String> processNames() {
        return handlers.keySet();
    }

    /**
     * {@link HandlerRegistry} 빌더.
     */
    public static final class Builder {

        private final Map<String, RetryHandler> handlers = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 핸들러 등록.
         *
         * @param processName 프로세스 이름
         * @param handler 핸들러
         * @return this
         * @throws IllegalArgumentException 인자가 null이거나 이미 등록된 이름인 경우
         */
        public Builder register(String processName, RetryHandler handler) {
            if (processName == null || processName.isBlank()) {
                throw new IllegalArgumentException("processName cannot be null or blank");
            }
            if (handler == null) {
                throw new IllegalArgumentException("handler cannot be null");
            }
            if (handlers.putIfAbsent(processName, handler) != null) {
                throw new IllegalArgumentException("handler already registered for processName: " + processName);
            }
            return this;
        }

        /**
         * 레지스트리 생성.
         *
         * @return 불변 HandlerRegistry
         */
        public HandlerRegistry build() {
            return new HandlerRegistry(handlers);
        }
    }
}
