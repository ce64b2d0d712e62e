package com.ryuqq.retry.core.spi;

/**
 * Raised by {@link RetryLogStore} implementations when storage access fails.
 *
 * <p>For {@link RetryLogStore#upsertAll} this means the whole batch was not persisted.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public class RetryPersistenceException extends RuntimeException {

    public RetryPersistenceException(String message) {
        super(message);
    }

    public RetryPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
