package com.ryuqq.retry.core.spi;

import com.ryuqq.retry.core.model.RetryPolicy;

import java.util.List;

/**
 * Read-only Configuration SPI for the retry policy table.
 *
 * <p>The table is managed out of band by admin tooling. The Retry Ledger never writes to it;
 * it reads the full table through {@link com.ryuqq.retry.core.config.RetryPolicyCache}.</p>
 *
 * <p><strong>Query Example:</strong></p>
 * <pre>
 * SELECT process_name, method_name, max_retry_count, retry_interval_minutes,
 *        start_first_retry_after_minutes, is_active
 * FROM retry_config;
 * </pre>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public interface RetryPolicySource {

    /**
     * Reads every policy row, active and inactive.
     *
     * @return all rows (never null, may be empty)
     * @throws RuntimeException if the table cannot be read
     */
    List<RetryPolicy> loadAll();
}
