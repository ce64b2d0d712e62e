/**
 * Retry policy resolution.
 *
 * <p>{@link com.ryuqq.retry.core.config.RetryPolicyCache} is an explicit cache object with a defined
 * lifecycle ({@code load / reload / invalidate}) handed to the components that need it.
 * Lookup keys are built by {@link com.ryuqq.retry.core.config.PolicyKey}.</p>
 *
 * @since 1.0.0
 * @author Retry Ledger Team
 */
package com.ryuqq.retry.core.config;
