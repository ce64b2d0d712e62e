/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide concrete functionality for the retry core.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.spi.RetryLogStore} - Retry chain persistence (bulk fetch, atomic bulk upsert, due scan)</li>
 *   <li>{@link com.ryuqq.retry.core.spi.RetryPolicySource} - Read-only retry policy table</li>
 *   <li>{@link com.ryuqq.retry.core.spi.NotificationPublisher} - Ingestion of attempt outcomes</li>
 *   <li>{@link com.ryuqq.retry.core.spi.NotificationBus} - At-least-once notification transport</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., retry-adapter-inmemory, a JDBC adapter) provide concrete implementations.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> InMemory for tests, database-backed for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Retry Ledger Team
 */
package com.ryuqq.retry.core.spi;
