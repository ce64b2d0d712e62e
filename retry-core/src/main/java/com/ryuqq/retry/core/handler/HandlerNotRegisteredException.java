package com.ryuqq.retry.core.handler;

/**
 * processName에 대응하는 {@link RetryHandler}가 레지스트리에 없을 때 발생.
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public class HandlerNotRegisteredException extends RuntimeException {

    private final String processName;

    public HandlerNotRegisteredException(String processName) {
        super("No retry handler registered for processName: " + processName);
        this.processName = processName;
    }

    public String getProcessName() {
        return processName;
    }
}
