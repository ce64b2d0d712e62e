package com.ryuqq.retry.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FailureNotification 테스트.
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
class FailureNotificationTest {

    @Test
    void failure_새_체인_미처리_실패_알림을_생성함() {
        // when
        FailureNotification notification = FailureNotification.failure(
            "OrderSync", "push", "{\"orderId\":1}", "{\"code\":503}", "service unavailable");

        // then
        assertThat(notification.isNewChain()).isTrue();
        assertThat(notification.status()).isEqualTo(NotificationStatus.FAILURE);
        assertThat(notification.processed()).isFalse();
        assertThat(notification.notificationId()).isNotBlank();
        assertThat(notification.overrides()).isEqualTo(RetryOverrides.none());
    }

    @Test
    void success_성공_알림을_생성함() {
        // when
        FailureNotification notification = FailureNotification.success("OrderSync", null, "{}", "{}");

        // then
        assertThat(notification.status()).isEqualTo(NotificationStatus.SUCCESS);
        assertThat(notification.errorMessage()).isNull();
    }

    @Test
    void with_메서드는_notificationId를_유지함() {
        // given
        FailureNotification original = FailureNotification.failure("OrderSync", null, "{}", null, "boom");
        RecordId recordId = RecordId.of("log-1");

        // when
        FailureNotification updated = original
            .withRecordId(recordId)
            .withOverrides(RetryOverrides.none().withMaxRetryLimit(2))
            .asProcessed();

        // then
        assertThat(updated.notificationId()).isEqualTo(original.notificationId());
        assertThat(updated.recordId()).isEqualTo(recordId);
        assertThat(updated.isNewChain()).isFalse();
        assertThat(updated.processed()).isTrue();
        assertThat(updated.overrides().maxRetryLimit()).isEqualTo(2);
        assertThat(original.processed()).isFalse();
    }

    @Test
    void 생성자_overrides가_null이면_none으로_대체함() {
        // when
        FailureNotification notification = new FailureNotification("n-1", null, "OrderSync", null,
            NotificationStatus.FAILURE, false, null, null, null, null);

        // then
        assertThat(notification.overrides()).isEqualTo(RetryOverrides.none());
    }

    @Test
    void 생성자_필수_필드_누락시_예외() {
        assertThatThrownBy(() -> new FailureNotification(" ", null, "OrderSync", null,
            NotificationStatus.FAILURE, false, null, null, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("notificationId cannot be null or blank");
        assertThatThrownBy(() -> new FailureNotification("n-1", null, null, null,
            NotificationStatus.FAILURE, false, null, null, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("processName cannot be null or blank");
        assertThatThrownBy(() -> new FailureNotification("n-1", null, "OrderSync", null,
            null, false, null, null, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("status cannot be null");
    }
}
