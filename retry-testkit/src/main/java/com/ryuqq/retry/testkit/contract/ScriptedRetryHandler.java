package com.ryuqq.retry.testkit.contract;

import com.ryuqq.retry.core.handler.RetryHandler;
import com.ryuqq.retry.core.model.FailureNotification;
import com.ryuqq.retry.core.model.RetryLogRecord;
import com.ryuqq.retry.core.spi.NotificationPublisher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * RetryHandler whose outcomes are scripted by the test.
 *
 * <p>Each invocation consumes the next scripted step and reports it back through the
 * {@link NotificationPublisher}, the same way a real handler re-enters the ledger.
 * When the script is empty the handler reports another failure.</p>
 *
 * <pre>
 * handler.thenFail("still down").thenSucceed();
 * </pre>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public final class ScriptedRetryHandler implements RetryHandler {

    private final NotificationPublisher publisher;
    private final Deque<Step> script = new ArrayDeque<>();
    private final List<RetryLogRecord> invocations = new ArrayList<>();

    public ScriptedRetryHandler(NotificationPublisher publisher) {
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        this.publisher = publisher;
    }

    public synchronized ScriptedRetryHandler thenFail(String errorMessage) {
        script.addLast(new Step(StepKind.FAIL, errorMessage, null));
        return this;
    }

    public synchronized ScriptedRetryHandler thenSucceed() {
        script.addLast(new Step(StepKind.SUCCEED, null, null));
        return this;
    }

    /**
     * Throws from {@link #invokeRetry(RetryLogRecord)} without reporting anything.
     */
    public synchronized ScriptedRetryHandler thenThrow(RuntimeException exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        script.addLast(new Step(StepKind.THROW, null, exception));
        return this;
    }

    @Override
    public synchronized void invokeRetry(RetryLogRecord record) {
        invocations.add(record);
        Step step = script.isEmpty() ? new Step(StepKind.FAIL, "retry failed", null) : script.removeFirst();

        switch (step.kind) {
            case SUCCEED:
                publisher.publish(FailureNotification
                    .success(record.processName(), record.methodName(), record.requestPayload(), "{\"retried\":true}")
                    .withRecordId(record.recordId()));
                break;
            case THROW:
                throw step.exception;
            default:
                publisher.publish(FailureNotification
                    .failure(record.processName(), record.methodName(), record.requestPayload(), null, step.errorMessage)
                    .withRecordId(record.recordId()));
        }
    }

    public synchronized List<RetryLogRecord> invocations() {
        return List.copyOf(invocations);
    }

    public synchronized int invocationCount() {
        return invocations.size();
    }

    private enum StepKind {
        FAIL,
        SUCCEED,
        THROW
    }

    private static final class Step {
        private final StepKind kind;
        private final String errorMessage;
        private final RuntimeException exception;

        Step(StepKind kind, String errorMessage, RuntimeException exception) {
            this.kind = kind;
            this.errorMessage = errorMessage;
            this.exception = exception;
        }
    }
}
