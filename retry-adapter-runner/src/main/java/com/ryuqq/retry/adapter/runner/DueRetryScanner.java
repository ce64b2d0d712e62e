package com.ryuqq.retry.adapter.runner;

import com.ryuqq.retry.application.dispatch.DispatchGateway;
import com.ryuqq.retry.core.model.RetryLogRecord;
import com.ryuqq.retry.core.spi.RetryLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 예정 시각이 지난 재시도 체인을 주기적으로 디스패치하는 스캐너.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. store.scanDue(now, batchSize) → [record1, record2, ...]
 *    (retryEnabled = true AND processed = false AND retryDueAt &lt;= now)
 * 2. For each record:
 *    gateway.executeRetry(recordId, processName)
 * 3. 성공/실패 카운트 로깅
 * </pre>
 *
 * <p><strong>중복 디스패치:</strong> 핸들러가 새 알림을 발행하기 전까지 레코드는 계속 due 상태이므로
 * 겹치는 스캔에서 같은 레코드가 다시 디스패치될 수 있습니다. 핸들러는 멱등해야 합니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public final class DueRetryScanner {

    private static final Logger log = LoggerFactory.getLogger(DueRetryScanner.class);

    private final RetryLogStore store;
    private final DispatchGateway gateway;
    private final Clock clock;
    private final DueRetryScannerConfig config;

    /**
     * 생성자.
     *
     * @param store 재시도 로그 저장소
     * @param gateway 디스패치 게이트웨이
     * @param clock 시계
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DueRetryScanner(RetryLogStore store, DispatchGateway gateway, Clock clock, DueRetryScannerConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.gateway = gateway;
        this.clock = clock;
        this.config = config;
    }

    /**
     * due 레코드 스캔 및 디스패치.
     *
     * @return 디스패치 성공 건수
     */
    public int scan() {
        log.debug("Due retry scan started");

        // 1. due 레코드 스캔
        List<RetryLogRecord> due = store.scanDue(clock.instant(), config.batchSize());

        // 2. 각 레코드 디스패치
        int dispatched = 0;
        for (RetryLogRecord record : due) {
            if (tryDispatch(record)) {
                dispatched++;
            }
        }

        // 3. 결과 로깅
        log.info("Due retry scan completed: {} dispatched out of {} due", dispatched, due.size());
        return dispatched;
    }

    /**
     * 주어진 스케줄러에 scanIntervalMs 주기로 스캔을 등록.
     *
     * <p>스캔 자체가 실패해도 다음 주기는 계속 실행됩니다.</p>
     *
     * @param scheduler 스케줄러
     * @return 등록된 작업 (취소용)
     * @throws IllegalArgumentException scheduler가 null인 경우
     */
    public ScheduledFuture<?> start(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        return scheduler.scheduleWithFixedDelay(
            this::scanSafely,
            config.scanIntervalMs(),
            config.scanIntervalMs(),
            TimeUnit.MILLISECONDS
        );
    }

    private void scanSafely() {
        try {
            scan();
        } catch (Exception e) {
            log.error("Due retry scan failed", e);
        }
    }

    /**
     * 개별 레코드 디스패치 시도.
     *
     * <p>게이트웨이 구현이 예외를 던지더라도 나머지 레코드는 계속 처리합니다.</p>
     */
    private boolean tryDispatch(RetryLogRecord record) {
        try {
            gateway.executeRetry(record.recordId(), record.processName());
            return true;
        } catch (Exception e) {
            log.error("Failed to dispatch {} in due retry scan", record.recordId(), e);
            return false;
        }
    }
}
