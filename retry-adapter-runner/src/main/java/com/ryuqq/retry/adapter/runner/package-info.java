/**
 * Retry Ledger runtime components.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.adapter.runner.ReconcilingRetryLedger} - 알림 배치 조정과 drift-free 스케줄 계산</li>
 *   <li>{@link com.ryuqq.retry.adapter.runner.NotificationConsumer} - 버스 → Ledger, ACK/NACK</li>
 *   <li>{@link com.ryuqq.retry.adapter.runner.DueRetryScanner} - due 레코드 주기 스캔</li>
 *   <li>{@link com.ryuqq.retry.adapter.runner.HandlerDispatchGateway} - processName → 핸들러 호출, 예외 격리</li>
 * </ul>
 *
 * <h2>Retry Loop</h2>
 * <pre>
 * handler ──publish──► NotificationBus ──pump──► NotificationConsumer ──reconcile──► RetryLogStore
 *    ▲                                                                                    │
 *    └───── HandlerDispatchGateway ◄──executeRetry── DueRetryScanner ◄──scanDue───────────┘
 * </pre>
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.adapter.runner.LedgerConfig}</li>
 *   <li>{@link com.ryuqq.retry.adapter.runner.DueRetryScannerConfig}</li>
 *   <li>{@link com.ryuqq.retry.adapter.runner.NotificationConsumerConfig}</li>
 * </ul>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
package com.ryuqq.retry.adapter.runner;
