/**
 * In-memory retry log store.
 *
 * <p>{@link com.ryuqq.retry.adapter.inmemory.store.InMemoryRetryLogStore} holds at most one
 * record per record id and applies each bulk upsert as a single unit. It also exposes
 * round-trip counters and failure injection so ledger tests can observe one bulk fetch and
 * one bulk write per batch.</p>
 *
 * @see com.ryuqq.retry.core.spi.RetryLogStore
 * @author Retry Ledger Team
 * @since 1.0.0
 */
package com.ryuqq.retry.adapter.inmemory.store;
