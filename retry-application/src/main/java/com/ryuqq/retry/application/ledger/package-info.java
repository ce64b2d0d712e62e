/**
 * Retry Ledger port.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.application.ledger.RetryLedger} - Batch reconciliation of notifications into retry log records</li>
 *   <li>{@link com.ryuqq.retry.application.ledger.ReconcileResult} - Reconciled / Unreconciled batch result</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (ReconcilingRetryLedger)
 *   ↓ implements
 * application (RetryLedger)
 *   ↓ depends on
 * core (FailureNotification, RetryLogRecord, RetryPolicyCache, RetryLogStore)
 * </pre>
 *
 * @since 1.0.0
 * @author Retry Ledger Team
 */
package com.ryuqq.retry.application.ledger;
