package com.ryuqq.retry.adapter.runner;

import com.ryuqq.retry.application.ledger.ReconcileResult;
import com.ryuqq.retry.application.ledger.RetryLedger;
import com.ryuqq.retry.core.config.RetryPolicyCache;
import com.ryuqq.retry.core.model.FailureNotification;
import com.ryuqq.retry.core.model.RecordId;
import com.ryuqq.retry.core.model.RetryLogRecord;
import com.ryuqq.retry.core.model.RetryOverrides;
import com.ryuqq.retry.core.model.RetryPolicy;
import com.ryuqq.retry.core.spi.RetryLogStore;
import com.ryuqq.retry.core.spi.RetryPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * RetryLedger 구현체.
 *
 * <p>알림 배치를 체인별 RetryLogRecord로 조정하고, 다음 재시도 시각을 drift 없이 계산합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * reconcile(batch)
 *   ↓
 * 1. 알림별 대상 RecordId 결정 (recordId 또는 notificationId에서 파생)
 *   ↓
 * 2. store.findAllById(ids) → 기존 레코드 한 번에 조회
 *   ↓
 * 3. For each notification:
 *    a. 레코드의 appliedNotificationIds 또는 이번 배치에 이미 있는 알림 → 중복 skip
 *    b. 대상 레코드가 processed=true (저장본 또는 배치 내 앞선 알림) → 종료 체인 skip
 *    c. 알림 필드로 레코드 구성
 *    d. 정책 조회 (Proc--Method → Proc)
 *    e. 재시도 대상이 아니면 retryEnabled=false, 스케줄 필드 유지
 *    f. 새 체인: overrides ?? policy 로 초기화, due = now + startAfter
 *       기존 체인: count+1, due = priorDue + priorInterval
 *    g. 한도 도달 시 retryEnabled=false (LedgerConfig)
 *   ↓
 * 4. store.upsertAll(records) → 배치 단위 원자적 저장
 * </pre>
 *
 * <p><strong>Drift-free 스케줄:</strong> 기존 체인의 다음 due 시각은 현재 시각이 아니라
 * 이전 due 시각에서 계산합니다. 조정이 늦게 실행되어도 간격이 줄어들지 않습니다.</p>
 *
 * <p><strong>멱등성:</strong> 레코드는 반영된 알림 ID를 최근
 * {@value RetryLogRecord#MAX_APPLIED_NOTIFICATION_IDS}개까지 보관합니다. 같은 배치 안에서
 * 다른 알림에 덮어쓰인 알림도 반영된 것으로 기록되므로 배치를 재전달받아도 카운트가 다시 오르지 않습니다.</p>
 *
 * <p><strong>종료 체인:</strong> processed=true로 닫힌 레코드는 이후 어떤 알림으로도 다시 열리지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 주입된 협력 객체 외 상태가 없으므로 서로 다른 배치를 동시에
 * 조정할 수 있습니다. 같은 배치 안에서 같은 RecordId를 가리키는 알림은 마지막 것이 남습니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public final class ReconcilingRetryLedger implements RetryLedger {

    private static final Logger log = LoggerFactory.getLogger(ReconcilingRetryLedger.class);

    private final RetryLogStore store;
    private final RetryPolicyCache policies;
    private final Clock clock;
    private final LedgerConfig config;

    /**
     * 생성자 (기본 LedgerConfig 사용).
     *
     * @param store 재시도 로그 저장소
     * @param policies 정책 캐시
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ReconcilingRetryLedger(RetryLogStore store, RetryPolicyCache policies, Clock clock) {
        this(store, policies, clock, new LedgerConfig());
    }

    /**
     * 생성자.
     *
     * @param store 재시도 로그 저장소
     * @param policies 정책 캐시
     * @param clock 시계
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ReconcilingRetryLedger(RetryLogStore store, RetryPolicyCache policies, Clock clock, LedgerConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (policies == null) {
            throw new IllegalArgumentException("policies cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.policies = policies;
        this.clock = clock;
        this.config = config;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException notifications가 null이거나 null 원소를 포함하는 경우
     * @throws com.ryuqq.retry.core.config.RetryConfigurationException 정책 테이블 로드 실패 시
     */
    @Override
    public ReconcileResult reconcile(List<FailureNotification> notifications) {
        if (notifications == null) {
            throw new IllegalArgumentException("notifications cannot be null");
        }
        for (FailureNotification notification : notifications) {
            if (notification == null) {
                throw new IllegalArgumentException("notifications cannot contain null");
            }
        }
        if (notifications.isEmpty()) {
            return ReconcileResult.Reconciled.empty();
        }

        // 1. 대상 id 결정 + 2. 일괄 조회
        Set<RecordId> targetIds = new LinkedHashSet<>();
        for (FailureNotification notification : notifications) {
            targetIds.add(targetId(notification));
        }

        Map<RecordId, RetryLogRecord> prior;
        try {
            prior = store.findAllById(targetIds);
        } catch (RetryPersistenceException e) {
            log.error("Failed to load {} retry records for batch of {}", targetIds.size(), notifications.size(), e);
            return new ReconcileResult.Unreconciled(notifications.size(), "Bulk fetch failed: " + e.getMessage());
        }

        // 3. 레코드 구성 (같은 id는 마지막 알림이 남음)
        Instant now = clock.instant();
        Map<RecordId, RetryLogRecord> merged = new LinkedHashMap<>();
        Map<RecordId, List<String>> appliedInBatch = new HashMap<>();
        int skippedDuplicates = 0;
        int skippedTerminal = 0;

        for (FailureNotification notification : notifications) {
            RecordId recordId = targetId(notification);
            String notificationId = notification.notificationId();
            RetryLogRecord existing = prior.get(recordId);
            List<String> batchIds = appliedInBatch.computeIfAbsent(recordId, id -> new ArrayList<>());

            if ((existing != null && existing.hasApplied(notificationId)) || batchIds.contains(notificationId)) {
                log.debug("Notification {} already applied to {}; skipping", notificationId, recordId);
                skippedDuplicates++;
                continue;
            }

            RetryLogRecord current = merged.getOrDefault(recordId, existing);
            if (current != null && current.processed()) {
                log.info("Notification {} targets processed record {}; keeping it closed", notificationId, recordId);
                skippedTerminal++;
                continue;
            }

            batchIds.add(notificationId);
            List<String> applied = RetryLogRecord.appendApplied(
                existing != null ? existing.appliedNotificationIds() : List.of(), batchIds);
            merged.put(recordId, build(recordId, notification, existing, applied, now));
        }

        if (merged.isEmpty()) {
            log.info("Reconciled batch of {}: nothing to write, {} duplicates and {} closed-record notifications skipped",
                notifications.size(), skippedDuplicates, skippedTerminal);
            return new ReconcileResult.Reconciled(List.of(), skippedDuplicates, skippedTerminal);
        }

        // 4. 일괄 저장
        List<RetryLogRecord> records = new ArrayList<>(merged.values());
        try {
            store.upsertAll(records);
        } catch (RetryPersistenceException e) {
            log.error("Failed to persist {} retry records for batch of {}", records.size(), notifications.size(), e);
            return new ReconcileResult.Unreconciled(notifications.size(), "Bulk upsert failed: " + e.getMessage());
        }

        log.info("Reconciled batch of {}: {} records written, {} duplicates and {} closed-record notifications skipped",
            notifications.size(), records.size(), skippedDuplicates, skippedTerminal);
        return new ReconcileResult.Reconciled(records, skippedDuplicates, skippedTerminal);
    }

    private static RecordId targetId(FailureNotification notification) {
        return notification.isNewChain()
            ? RecordId.derivedFrom(notification.notificationId())
            : notification.recordId();
    }

    private RetryLogRecord build(RecordId recordId, FailureNotification notification, RetryLogRecord existing,
                                 List<String> applied, Instant now) {
        Optional<RetryPolicy> policy = policies.resolve(notification.processName(), notification.methodName());
        boolean eligible = policy.isPresent() && !notification.processed() && notification.status().isFailure();

        if (!eligible) {
            return notAdvanced(recordId, notification, existing, applied, now);
        }
        if (existing == null || !existing.isScheduled()) {
            return startChain(recordId, notification, existing, policy.get(), applied, now);
        }
        return advanceChain(recordId, notification, existing, policy.get(), applied, now);
    }

    /**
     * 재시도 대상이 아닌 알림: 상태 필드만 반영하고 스케줄은 건드리지 않음.
     */
    private RetryLogRecord notAdvanced(RecordId recordId, FailureNotification n, RetryLogRecord existing,
                                       List<String> applied, Instant now) {
        if (existing == null) {
            return record(recordId, n, false, null, null, 0, null, applied, now);
        }
        return record(recordId, n, false, existing.retryIntervalMinutes(), existing.maxRetryLimit(),
            existing.retryCount(), existing.retryDueAt(), applied, now);
    }

    /**
     * 새 체인: overrides가 있으면 우선, 없으면 정책 값.
     */
    private RetryLogRecord startChain(RecordId recordId, FailureNotification n, RetryLogRecord existing,
                                      RetryPolicy policy, List<String> applied, Instant now) {
        RetryOverrides overrides = n.overrides();
        int retryCount = orDefault(overrides.retryCount(), 0);
        if (existing != null) {
            retryCount = Math.max(retryCount, existing.retryCount());
        }
        int maxRetryLimit = orDefault(overrides.maxRetryLimit(), policy.maxRetryCount());
        int interval = orDefault(overrides.retryIntervalMinutes(), policy.retryIntervalMinutes());
        int startAfter = orDefault(overrides.startFirstRetryAfterMinutes(), policy.startFirstRetryAfterMinutes());

        if (limitReached(retryCount, maxRetryLimit)) {
            log.info("Retry chain {} created at its limit ({}/{}); not scheduling", recordId, retryCount, maxRetryLimit);
            return record(recordId, n, false, interval, maxRetryLimit, retryCount, null, applied, now);
        }
        return record(recordId, n, true, interval, maxRetryLimit, retryCount,
            now.plus(Duration.ofMinutes(startAfter)), applied, now);
    }

    /**
     * 기존 체인: overrides 무시, 이전 due 시각 기준으로 전진.
     */
    private RetryLogRecord advanceChain(RecordId recordId, FailureNotification n, RetryLogRecord existing,
                                        RetryPolicy policy, List<String> applied, Instant now) {
        int interval = orDefault(existing.retryIntervalMinutes(), policy.retryIntervalMinutes());
        int maxRetryLimit = orDefault(existing.maxRetryLimit(), policy.maxRetryCount());
        int retryCount = existing.retryCount() + 1;

        if (limitReached(retryCount, maxRetryLimit)) {
            log.info("Retry chain {} reached its limit ({}/{}); disabling", recordId, retryCount, maxRetryLimit);
            return record(recordId, n, false, interval, maxRetryLimit, retryCount, existing.retryDueAt(), applied, now);
        }
        return record(recordId, n, true, interval, maxRetryLimit, retryCount,
            existing.retryDueAt().plus(Duration.ofMinutes(interval)), applied, now);
    }

    private boolean limitReached(int retryCount, int maxRetryLimit) {
        return config.enforceRetryLimit() && retryCount >= maxRetryLimit;
    }

    private static RetryLogRecord record(RecordId recordId, FailureNotification n, boolean retryEnabled,
                                         Integer interval, Integer maxRetryLimit, int retryCount,
                                         Instant retryDueAt, List<String> applied, Instant now) {
        return new RetryLogRecord(
            recordId,
            n.processName(),
            n.methodName(),
            n.status(),
            n.processed(),
            n.requestPayload(),
            n.responsePayload(),
            n.errorMessage(),
            retryEnabled,
            interval,
            maxRetryLimit,
            retryCount,
            retryDueAt,
            applied,
            now
        );
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
