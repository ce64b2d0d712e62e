package com.ryuqq.retry.application.ledger;

import com.ryuqq.retry.core.model.NotificationStatus;
import com.ryuqq.retry.core.model.RecordId;
import com.ryuqq.retry.core.model.RetryLogRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ReconcileResult 테스트.
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
class ReconcileResultTest {

    @Test
    void reconciled_레코드를_id로_찾을_수_있음() {
        // given
        RetryLogRecord record = new RetryLogRecord(RecordId.of("log-1"), "OrderSync", null,
            NotificationStatus.SUCCESS, true, null, null, null, false, null, null, 0, null, List.of("n-1"),
            Instant.EPOCH);

        // when
        ReconcileResult.Reconciled result = new ReconcileResult.Reconciled(List.of(record), 0);

        // then
        assertThat(result.isReconciled()).isTrue();
        assertThat(result.find(RecordId.of("log-1"))).contains(record);
        assertThat(result.find(RecordId.of("log-2"))).isEmpty();
    }

    @Test
    void reconciled_레코드_목록은_방어적_복사됨() {
        // given
        List<RetryLogRecord> records = new ArrayList<>();
        ReconcileResult.Reconciled result = new ReconcileResult.Reconciled(records, 0);

        // when & then
        assertThatThrownBy(() -> result.records().add(null))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void reconciled_종료_체인_skip_수는_기본_0이고_음수면_예외() {
        assertThat(new ReconcileResult.Reconciled(List.of(), 2).skippedTerminal()).isZero();
        assertThat(ReconcileResult.Reconciled.empty().skippedTerminal()).isZero();
        assertThatThrownBy(() -> new ReconcileResult.Reconciled(List.of(), 0, -1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("skippedTerminal must be non-negative");
    }

    @Test
    void unreconciled_조정_실패를_나타냄() {
        ReconcileResult result = new ReconcileResult.Unreconciled(3, "DB error");

        assertThat(result.isReconciled()).isFalse();
    }

    @Test
    void unreconciled_사유가_비어있으면_예외() {
        assertThatThrownBy(() -> new ReconcileResult.Unreconciled(3, " "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("reason cannot be null or blank");
    }
}
