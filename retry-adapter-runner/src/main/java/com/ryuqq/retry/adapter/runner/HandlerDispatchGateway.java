package com.ryuqq.retry.adapter.runner;

import com.ryuqq.retry.application.dispatch.DispatchGateway;
import com.ryuqq.retry.core.handler.HandlerNotRegisteredException;
import com.ryuqq.retry.core.handler.HandlerRegistry;
import com.ryuqq.retry.core.handler.RetryHandler;
import com.ryuqq.retry.core.model.RecordId;
import com.ryuqq.retry.core.model.RetryLogRecord;
import com.ryuqq.retry.core.spi.RetryLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * DispatchGateway 구현체.
 *
 * <p>예정 시각이 지난 체인의 레코드를 조회하고, processName으로 등록된 핸들러를 호출합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * executeRetry(logId, processName)
 *   ↓
 * 1. store.findById(logId) → 없으면 경고 후 종료
 * 2. registry.require(processName) → 핸들러
 * 3. handler.invokeRetry(record)
 * 4. finally: 결과 로깅
 * </pre>
 *
 * <p><strong>예외 처리:</strong> 조회, 핸들러 해석, 호출 중 발생한 모든 예외는 로깅 후 삼킵니다.
 * 한 건의 실패가 스케줄러의 다른 레코드 처리를 막지 않습니다. Ledger 상태는 변경하지 않으며,
 * 다음 시도가 필요하면 핸들러가 직접 실패 알림을 발행합니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public final class HandlerDispatchGateway implements DispatchGateway {

    private static final Logger log = LoggerFactory.getLogger(HandlerDispatchGateway.class);

    private final RetryLogStore store;
    private final HandlerRegistry registry;

    /**
     * 생성자.
     *
     * @param store 재시도 로그 저장소
     * @param registry 핸들러 레지스트리
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public HandlerDispatchGateway(RetryLogStore store, HandlerRegistry registry) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.store = store;
        this.registry = registry;
    }

    @Override
    public void executeRetry(RecordId logId, String processName) {
        DispatchOutcome outcome = DispatchOutcome.FAILED;
        long startedAt = System.currentTimeMillis();

        try {
            if (logId == null) {
                throw new IllegalArgumentException("logId cannot be null");
            }

            Optional<RetryLogRecord> record = store.findById(logId);
            if (record.isEmpty()) {
                log.warn("Retry record {} not found; nothing to dispatch", logId);
                outcome = DispatchOutcome.SKIPPED;
                return;
            }

            RetryHandler handler = registry.require(processName);
            handler.invokeRetry(record.get());
            outcome = DispatchOutcome.INVOKED;

        } catch (HandlerNotRegisteredException e) {
            log.error("No retry handler registered for processName={} (record {})", processName, logId, e);
        } catch (Exception e) {
            log.error("Retry dispatch failed for record {} (processName={})", logId, processName, e);
        } finally {
            log.info("Retry dispatch for record {} (processName={}) finished: {} in {}ms",
                logId, processName, outcome, System.currentTimeMillis() - startedAt);
        }
    }

    private enum DispatchOutcome {
        INVOKED,
        SKIPPED,
        FAILED
    }
}
