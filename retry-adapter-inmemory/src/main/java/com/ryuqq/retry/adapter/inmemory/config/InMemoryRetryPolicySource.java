package com.ryuqq.retry.adapter.inmemory.config;

import com.ryuqq.retry.core.model.RetryPolicy;
import com.ryuqq.retry.core.spi.RetryPolicySource;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory retry policy table.
 *
 * <p>Rows may be added or replaced at any time; changes become visible to a
 * {@link com.ryuqq.retry.core.config.RetryPolicyCache} only after its next reload.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public class InMemoryRetryPolicySource implements RetryPolicySource {

    private final CopyOnWriteArrayList<RetryPolicy> rows;
    private final AtomicInteger loads;

    /**
     * Creates an empty policy table.
     */
    public InMemoryRetryPolicySource() {
        this.rows = new CopyOnWriteArrayList<>();
        this.loads = new AtomicInteger();
    }

    /**
     * Creates a policy table with initial rows.
     *
     * @param initial initial rows
     * @throws IllegalArgumentException if initial is null or contains null
     */
    public InMemoryRetryPolicySource(List<RetryPolicy> initial) {
        this();
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        initial.forEach(this::add);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<RetryPolicy> loadAll() {
        loads.incrementAndGet();
        return List.copyOf(rows);
    }

    /**
     * Adds a row.
     *
     * @param policy the row
     * @return this source
     * @throws IllegalArgumentException if policy is null
     */
    public InMemoryRetryPolicySource add(RetryPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        rows.add(policy);
        return this;
    }

    /**
     * Replaces every row sharing the policy's lookup key with the given policy.
     *
     * @param policy the row
     * @return this source
     * @throws IllegalArgumentException if policy is null
     */
    public InMemoryRetryPolicySource replace(RetryPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        rows.removeIf(existing -> existing.key().equals(policy.key()));
        rows.add(policy);
        return this;
    }

    /**
     * Number of {@link #loadAll()} calls so far. Used for test assertions.
     *
     * @return load count
     */
    public int loadCount() {
        return loads.get();
    }

    /**
     * Removes all rows and resets the load counter.
     */
    public void clear() {
        rows.clear();
        loads.set(0);
    }
}
