package com.ryuqq.retry.core.config;

import com.ryuqq.retry.core.model.RetryPolicy;
import com.ryuqq.retry.core.spi.RetryPolicySource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 재시도 정책 캐시 (Config Resolver).
 *
 * <p>설정 테이블 전체를 한 번 로드해 키 → 정책 맵으로 보관하고,
 * 알림마다 테이블을 스캔하지 않고 메모리에서 조회합니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * new RetryPolicyCache(source)   → 아직 로드 안 됨
 * resolve(...) 최초 호출         → load() 자동 수행 (lazy)
 * reload()                       → 전체 재구성 후 원자적 교체
 * invalidate()                   → 다음 resolve() 시 재로드
 * </pre>
 *
 * <p><strong>조회 우선순위:</strong></p>
 * <ol>
 *   <li>{@code processName--methodName} (methodName이 있는 경우)</li>
 *   <li>{@code processName}</li>
 * </ol>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>조회 미스: {@link Optional#empty()} (오류 아님, 부수 효과 없음)</li>
 *   <li>로드 실패 / 중복 키: {@link RetryConfigurationException} (치명적 설정 오류)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 맵은 volatile 참조로 통째로 교체되며 부분 무효화는 없습니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public final class RetryPolicyCache {

    private final RetryPolicySource source;
    private volatile Map<String, RetryPolicy> policies;

    /**
     * 생성자.
     *
     * @param source 정책 테이블 소스
     * @throws IllegalArgumentException source가 null인 경우
     */
    public RetryPolicyCache(RetryPolicySource source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.source = source;
    }

    /**
     * 아직 로드되지 않았다면 정책 테이블을 로드.
     *
     * <p>이미 로드된 경우 아무 작업도 하지 않습니다.</p>
     *
     * @throws RetryConfigurationException 로드 실패 시
     */
    public void load() {
        snapshot();
    }

    /**
     * 정책 테이블을 다시 읽어 캐시를 원자적으로 교체.
     *
     * <p>재구성 실패 시 기존 캐시는 유지되고 예외가 전파됩니다.</p>
     *
     * @throws RetryConfigurationException 로드 실패 시
     */
    public synchronized void reload() {
        policies = build();
    }

    /**
     * 캐시 무효화. 다음 조회 시 전체 재로드됩니다.
     */
    public synchronized void invalidate() {
        policies = null;
    }

    /**
     * 로드 여부 확인.
     *
     * @return 캐시가 구성되어 있으면 true
     */
    public boolean isLoaded() {
        return policies != null;
    }

    /**
     * 캐시된 활성 정책 수.
     *
     * @return 정책 수 (필요 시 로드)
     */
    public int size() {
        return snapshot().size();
    }

    /**
     * 프로세스/메서드에 적용할 정책 조회.
     *
     * @param processName 프로세스 이름
     * @param methodName 메서드 이름 (null 가능)
     * @return 적용 정책, 없으면 empty
     * @throws IllegalArgumentException processName이 null이거나 빈 문자열인 경우
     * @throws RetryConfigurationException 최초 로드 실패 시
     */
    public Optional<RetryPolicy> resolve(String processName, String methodName) {
        Map<String, RetryPolicy> current = snapshot();

        String processKey = PolicyKey.of(processName, null);
        String methodKey = PolicyKey.of(processName, methodName);

        if (!methodKey.equals(processKey)) {
            RetryPolicy methodPolicy = current.get(methodKey);
            if (methodPolicy != null) {
                return Optional.of(methodPolicy);
            }
        }
        return Optional.ofNullable(current.get(processKey));
    }

    private Map<String, RetryPolicy> snapshot() {
        Map<String, RetryPolicy> current = policies;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (policies == null) {
                policies = build();
            }
            return policies;
        }
    }

    private Map<String, RetryPolicy> build() {
        List<RetryPolicy> rows;
        try {
            rows = source.loadAll();
        } catch (RuntimeException e) {
            throw new RetryConfigurationException("Failed to load retry policies", e);
        }
        if (rows == null) {
            throw new RetryConfigurationException("Retry policy source returned null");
        }

        Map<String, RetryPolicy> built = new HashMap<>();
        for (RetryPolicy row : rows) {
            if (!row.active()) {
                continue;
            }
            RetryPolicy previous = built.putIfAbsent(row.key(), row);
            if (previous != null) {
                throw new RetryConfigurationException("Duplicate active retry policy for key: " + row.key());
            }
        }
        return Map.copyOf(built);
    }
}
