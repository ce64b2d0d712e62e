/**
 * Core domain model package containing value objects and records of the retry ledger.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.model.RecordId} - Retry chain identifier</li>
 *   <li>{@link com.ryuqq.retry.core.model.NotificationStatus} - Attempt outcome (SUCCESS / FAILURE)</li>
 *   <li>{@link com.ryuqq.retry.core.model.RetryOverrides} - Per-notification policy overrides</li>
 * </ul>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.model.RetryPolicy} - Configured retry parameters for a process/method</li>
 *   <li>{@link com.ryuqq.retry.core.model.FailureNotification} - Ephemeral attempt outcome event</li>
 *   <li>{@link com.ryuqq.retry.core.model.RetryLogRecord} - Persistent state of one retry chain</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All types are immutable; updates produce new instances</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Retry Ledger Team
 */
package com.ryuqq.retry.core.model;
