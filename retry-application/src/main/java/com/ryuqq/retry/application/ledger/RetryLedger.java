package com.ryuqq.retry.application.ledger;

import com.ryuqq.retry.core.model.FailureNotification;

import java.util.List;

/**
 * Retry Ledger: log reconciliation engine.
 *
 * <p>Turns an unordered stream of success/failure notifications into one correctly scheduled,
 * monotonically advancing retry-state record per chain.</p>
 *
 * <p><strong>Reconciliation Flow (per batch):</strong></p>
 * <pre>
 * 1. Partition batch: existing chains (recordId present) vs new chains
 * 2. Bulk-load referenced records (one fetch)
 * 3. Overwrite status fields from each notification
 * 4. Resolve policy (Proc--Method, then Proc)
 *    - no policy / processed / SUCCESS → retryEnabled = false, schedule not advanced
 * 5. Eligible:
 *    - new chain:      retryCount = override ?? 0
 *                      retryDueAt = now + (override ?? startFirstRetryAfter)
 *    - existing chain: retryCount = prior + 1
 *                      retryDueAt = priorDueAt + priorInterval   (drift-free)
 * 6. Bulk upsert (all-or-nothing)
 * </pre>
 *
 * <p><strong>Guarantees:</strong></p>
 * <ul>
 *   <li>retryCount and retryDueAt never decrease for a given chain</li>
 *   <li>Per-notification overrides apply only at chain creation</li>
 *   <li>Persistence failures are reported via {@link ReconcileResult.Unreconciled}, never thrown</li>
 *   <li>Concurrent calls with disjoint record sets are safe</li>
 * </ul>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public interface RetryLedger {

    /**
     * Reconciles a batch of notifications into retry log records.
     *
     * @param notifications the batch (may be empty)
     * @return {@link ReconcileResult.Reconciled} with the persisted records, or
     *         {@link ReconcileResult.Unreconciled} when the batch could not be persisted
     * @throws IllegalArgumentException if notifications is null or contains null
     * @throws com.ryuqq.retry.core.config.RetryConfigurationException if the policy table cannot be loaded
     */
    ReconcileResult reconcile(List<FailureNotification> notifications);
}
