package com.ryuqq.retry.testkit.contract;

import com.ryuqq.retry.adapter.inmemory.config.JsonRetryPolicySource;
import com.ryuqq.retry.adapter.runner.ReconcilingRetryLedger;
import com.ryuqq.retry.core.config.RetryPolicyCache;
import com.ryuqq.retry.core.model.FailureNotification;
import com.ryuqq.retry.core.model.RecordId;
import com.ryuqq.retry.core.model.RetryLogRecord;
import com.ryuqq.retry.core.model.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for policy resolution.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Proc--Method policy wins over Proc policy</li>
 *   <li>Inactive policy behaves as no policy</li>
 *   <li>Policy changes apply after reload, only to new chains</li>
 *   <li>JSON policy table drives the ledger</li>
 * </ul>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
class PolicyPrecedenceContractTest extends AbstractContractTest {

    @Test
    void testMethodPolicyWinsOverProcessPolicy() {
        // Given
        givenPolicy(RetryPolicy.of(PROCESS, null, 5, 60, 10));
        givenPolicy(RetryPolicy.of(PROCESS, METHOD, 2, 15, 1));

        // When
        RecordId method = ingest(failure());
        RecordId process = ingest(FailureNotification.failure(PROCESS, "pull", "{}", null, "timeout"));

        // Then
        assertEquals(2, record(method).maxRetryLimit());
        assertEquals(START.plus(Duration.ofMinutes(1)), record(method).retryDueAt());
        assertEquals(5, record(process).maxRetryLimit());
        assertEquals(START.plus(Duration.ofMinutes(10)), record(process).retryDueAt());
    }

    @Test
    void testInactivePolicy_RetryDisabled() {
        // Given
        givenPolicy(RetryPolicy.of(PROCESS, METHOD, 3, 30, 5).deactivated());

        // When
        RecordId id = ingest(failure());

        // Then
        assertFalse(record(id).retryEnabled());
        assertNull(record(id).retryDueAt());
    }

    @Test
    void testReload_NewValuesOnlyForNewChains() {
        // Given
        givenPolicy(RetryPolicy.of(PROCESS, METHOD, 3, 30, 5));
        RecordId existing = ingest(failure());

        // When
        policySource.replace(RetryPolicy.of(PROCESS, METHOD, 10, 5, 0));
        policyCache.reload();
        RecordId fresh = ingest(failure());
        RetryLogRecord advanced = runDueRetry(existing);

        // Then
        assertEquals(3, advanced.maxRetryLimit());
        assertEquals(30, advanced.retryIntervalMinutes());
        assertEquals(10, record(fresh).maxRetryLimit());
        assertEquals(5, record(fresh).retryIntervalMinutes());
    }

    @Test
    void testJsonPolicyTable() {
        // Given
        RetryPolicyCache jsonCache = new RetryPolicyCache(JsonRetryPolicySource.fromClasspath("contract-policies.json"));
        jsonCache.load();
        ReconcilingRetryLedger jsonLedger = new ReconcilingRetryLedger(store, jsonCache, clock);

        // When
        FailureNotification methodLevel = failure();
        FailureNotification processLevel = FailureNotification.failure(PROCESS, "pull", "{}", null, "timeout");
        FailureNotification inactive = FailureNotification.failure("Legacy", null, "{}", null, "timeout");
        assertTrue(jsonLedger.reconcile(List.of(methodLevel, processLevel, inactive)).isReconciled());

        // Then
        assertEquals(4, record(RecordId.derivedFrom(methodLevel.notificationId())).maxRetryLimit());
        assertEquals(2, record(RecordId.derivedFrom(processLevel.notificationId())).maxRetryLimit());
        assertFalse(record(RecordId.derivedFrom(inactive.notificationId())).retryEnabled());
        assertEquals(3, jsonCache.size());
    }
}
