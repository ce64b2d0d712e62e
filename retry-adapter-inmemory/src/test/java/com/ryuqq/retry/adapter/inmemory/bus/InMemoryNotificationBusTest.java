package com.ryuqq.retry.adapter.inmemory.bus;

import com.ryuqq.retry.core.model.FailureNotification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryNotificationBus 유닛 테스트.
 *
 * <p>publish → dequeue → ack/nack 생명주기와 at-least-once 재전달을 검증합니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
class InMemoryNotificationBusTest {

    private InMemoryNotificationBus bus;

    @BeforeEach
    void setUp() {
        bus = new InMemoryNotificationBus();
    }

    @Test
    void dequeue_발행_순서대로_batchSize만큼_꺼내고_in_flight로_표시함() {
        // given
        FailureNotification first = failure("first");
        FailureNotification second = failure("second");
        FailureNotification third = failure("third");
        bus.publishAll(List.of(first, second, third));

        // when
        List<FailureNotification> batch = bus.dequeue(2);

        // then
        assertThat(batch).containsExactly(first, second);
        assertThat(bus.queueSize()).isEqualTo(1);
        assertThat(bus.inFlightSize()).isEqualTo(2);
    }

    @Test
    void dequeue_빈_큐는_빈_목록() {
        assertThat(bus.dequeue(10)).isEmpty();
    }

    @Test
    void ack_in_flight에서_영구_제거함() {
        // given
        FailureNotification notification = failure("ack");
        bus.publish(notification);
        bus.dequeue(1);

        // when
        bus.ack(notification);
        bus.ack(notification);

        // then
        assertThat(bus.inFlightSize()).isZero();
        assertThat(bus.queueSize()).isZero();
    }

    @Test
    void nack_같은_notificationId로_재전달함() {
        // given
        FailureNotification notification = failure("nack");
        bus.publish(notification);
        bus.dequeue(1);

        // when
        bus.nack(notification);
        bus.nack(notification);
        List<FailureNotification> redelivered = bus.dequeue(10);

        // then
        assertThat(redelivered).hasSize(1);
        assertThat(redelivered.get(0).notificationId()).isEqualTo(notification.notificationId());
    }

    @Test
    void expireVisibilityTimeout_in_flight인_경우에만_재전달함() {
        // given
        FailureNotification notification = failure("expire");
        bus.publish(notification);

        // when & then
        assertThat(bus.expireVisibilityTimeout(notification)).isFalse();
        bus.dequeue(1);
        assertThat(bus.expireVisibilityTimeout(notification)).isTrue();
        assertThat(bus.queueSize()).isEqualTo(1);
        assertThat(bus.inFlightSize()).isZero();
    }

    @Test
    void processVisibilityTimeouts_만료된_항목을_큐로_되돌림() throws InterruptedException {
        // given
        InMemoryNotificationBus shortBus = new InMemoryNotificationBus(1);
        shortBus.publish(failure("timeout"));
        shortBus.dequeue(1);
        Thread.sleep(5);

        // when
        int returned = shortBus.processVisibilityTimeouts();

        // then
        assertThat(returned).isEqualTo(1);
        assertThat(shortBus.queueSize()).isEqualTo(1);
    }

    @Test
    void 잘못된_인자는_예외() {
        assertThatThrownBy(() -> new InMemoryNotificationBus(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bus.publish(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("notification cannot be null");
        assertThatThrownBy(() -> bus.dequeue(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bus.publishAll(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static FailureNotification failure(String error) {
        return FailureNotification.failure("OrderSync", "push", "{}", null, error);
    }
}
