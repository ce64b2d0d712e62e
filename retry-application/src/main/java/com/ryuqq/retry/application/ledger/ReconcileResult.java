package com.ryuqq.retry.application.ledger;

import com.ryuqq.retry.core.model.RecordId;
import com.ryuqq.retry.core.model.RetryLogRecord;

import java.util.List;
import java.util.Optional;

/**
 * 배치 조정 결과.
 *
 * <ul>
 *   <li>{@link Reconciled}: 배치 전체가 영속화됨</li>
 *   <li>{@link Unreconciled}: 영속화 실패, 배치의 어떤 레코드도 반영되지 않음</li>
 * </ul>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public sealed interface ReconcileResult permits ReconcileResult.Reconciled, ReconcileResult.Unreconciled {

    /**
     * 조정 성공 여부.
     *
     * @return Reconciled이면 true
     */
    default boolean isReconciled() {
        return this instanceof Reconciled;
    }

    /**
     * 배치 조정 성공.
     *
     * @param records 영속화된 레코드 (배치 내 중복 id는 마지막 값 하나)
     * @param skippedDuplicates 이미 반영된 알림이라 건너뛴 수
     * @param skippedTerminal 이미 처리 완료(processed)된 체인을 가리켜 건너뛴 수
     */
    record Reconciled(List<RetryLogRecord> records, int skippedDuplicates, int skippedTerminal)
            implements ReconcileResult {

        public Reconciled {
            if (records == null) {
                throw new IllegalArgumentException("records cannot be null");
            }
            if (skippedDuplicates < 0) {
                throw new IllegalArgumentException("skippedDuplicates must be non-negative (current: " + skippedDuplicates + ")");
            }
            if (skippedTerminal < 0) {
                throw new IllegalArgumentException("skippedTerminal must be non-negative (current: " + skippedTerminal + ")");
            }
            records = List.copyOf(records);
        }

        /**
         * 종료 체인 skip이 없는 결과 생성.
         *
         * @param records 영속화된 레코드
         * @param skippedDuplicates 이미 반영된 알림이라 건너뛴 수
         */
        public Reconciled(List<RetryLogRecord> records, int skippedDuplicates) {
            this(records, skippedDuplicates, 0);
        }

        /**
         * 빈 배치 결과.
         *
         * @return 레코드 없는 Reconciled
         */
        public static Reconciled empty() {
            return new Reconciled(List.of(), 0, 0);
        }

        /**
         * id로 결과 레코드 조회.
         *
         * @param recordId 레코드 ID
         * @return 레코드, 없으면 empty
         */
        public Optional<RetryLogRecord> find(RecordId recordId) {
            return records.stream()
                .filter(record -> record.recordId().equals(recordId))
                .findFirst();
        }
    }

    /**
     * 배치 조정 실패 (영속화 실패).
     *
     * @param batchSize 실패한 배치 크기
     * @param reason 실패 사유
     */
    record Unreconciled(int batchSize, String reason) implements ReconcileResult {

        public Unreconciled {
            if (batchSize < 0) {
                throw new IllegalArgumentException("batchSize must be non-negative (current: " + batchSize + ")");
            }
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }
}
