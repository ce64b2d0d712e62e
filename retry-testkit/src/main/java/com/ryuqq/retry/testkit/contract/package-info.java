/**
 * Contract test support for the retry loop.
 *
 * <ul>
 *   <li>{@link com.ryuqq.retry.testkit.contract.AbstractContractTest} - wires store, bus, ledger, scanner, gateway and consumer</li>
 *   <li>{@link com.ryuqq.retry.testkit.contract.ScriptedRetryHandler} - handler with scripted outcomes</li>
 *   <li>{@link com.ryuqq.retry.testkit.contract.MutableClock} - manually advanced clock</li>
 * </ul>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
package com.ryuqq.retry.testkit.contract;
