/**
 * Retry policy table sources.
 *
 * <ul>
 *   <li>{@link com.ryuqq.retry.adapter.inmemory.config.InMemoryRetryPolicySource} - mutable rows for tests</li>
 *   <li>{@link com.ryuqq.retry.adapter.inmemory.config.JsonRetryPolicySource} - JSON array from classpath or string (Jackson)</li>
 * </ul>
 *
 * @see com.ryuqq.retry.core.spi.RetryPolicySource
 * @see com.ryuqq.retry.core.config.RetryPolicyCache
 * @author Retry Ledger Team
 * @since 1.0.0
 */
package com.ryuqq.retry.adapter.inmemory.config;
