package com.ryuqq.retry.adapter.runner;

import com.ryuqq.retry.application.ledger.ReconcileResult;
import com.ryuqq.retry.application.ledger.RetryLedger;
import com.ryuqq.retry.core.config.RetryConfigurationException;
import com.ryuqq.retry.core.model.FailureNotification;
import com.ryuqq.retry.core.spi.NotificationBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * NotificationConsumer 유닛 테스트.
 *
 * <p>배치 단위 조정 결과에 따라 ACK / NACK 하는지 검증합니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class NotificationConsumerTest {

    @Mock
    private NotificationBus bus;

    @Mock
    private RetryLedger ledger;

    private NotificationConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new NotificationConsumer(bus, ledger, new NotificationConsumerConfig().withBatchSize(10));
    }

    @Test
    void pump_Reconciled면_배치_전체를_ACK함() {
        // given
        FailureNotification first = notification();
        FailureNotification second = notification();
        when(bus.dequeue(10)).thenReturn(List.of(first, second));
        when(ledger.reconcile(List.of(first, second))).thenReturn(ReconcileResult.Reconciled.empty());

        // when
        int pumped = consumer.pump();

        // then
        assertThat(pumped).isEqualTo(2);
        verify(ledger, times(1)).reconcile(any());
        verify(bus).ack(first);
        verify(bus).ack(second);
        verify(bus, never()).nack(any());
    }

    @Test
    void pump_Unreconciled면_배치_전체를_NACK함() {
        // given
        FailureNotification first = notification();
        when(bus.dequeue(10)).thenReturn(List.of(first));
        when(ledger.reconcile(any())).thenReturn(new ReconcileResult.Unreconciled(1, "Bulk upsert failed: timeout"));

        // when
        consumer.pump();

        // then
        verify(bus).nack(first);
        verify(bus, never()).ack(any());
    }

    @Test
    void pump_조정_중_예외는_NACK_후_전파함() {
        // given
        FailureNotification first = notification();
        when(bus.dequeue(10)).thenReturn(List.of(first));
        when(ledger.reconcile(any())).thenThrow(new RetryConfigurationException("Failed to load retry policies"));

        // when & then
        assertThatThrownBy(() -> consumer.pump())
            .isInstanceOf(RetryConfigurationException.class);
        verify(bus).nack(first);
    }

    @Test
    void pump_빈_큐면_Ledger를_호출하지_않음() {
        // given
        when(bus.dequeue(10)).thenReturn(List.of());

        // when
        int pumped = consumer.pump();

        // then
        assertThat(pumped).isZero();
        verifyNoInteractions(ledger);
    }

    @Test
    void 설정값_검증() {
        assertThatThrownBy(() -> new NotificationConsumerConfig(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("batchSize must be positive (current: 0)");
        assertThat(new NotificationConsumerConfig().batchSize()).isEqualTo(100);
        assertThatThrownBy(() -> new NotificationConsumer(bus, null, new NotificationConsumerConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("ledger cannot be null");
    }

    private static FailureNotification notification() {
        return FailureNotification.failure("OrderSync", "push", "{}", null, "timeout");
    }
}
