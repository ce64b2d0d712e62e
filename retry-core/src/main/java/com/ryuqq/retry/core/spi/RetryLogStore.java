package com.ryuqq.retry.core.spi;

import com.ryuqq.retry.core.model.RecordId;
import com.ryuqq.retry.core.model.RetryLogRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent Storage SPI for retry log records.
 *
 * <p>This interface abstracts the table of {@link RetryLogRecord} rows, one per retry chain,
 * used by the Retry Ledger for reconciliation and by the scheduler glue for due-time polling.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Bulk lookup of existing chains referenced by a notification batch</li>
 *   <li>Atomic bulk upsert of reconciled records (the batch atomicity boundary)</li>
 *   <li>Single-record lookup for dispatch</li>
 *   <li>Due-time scan for the scheduler</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>ACID: {@link #upsertAll(Collection)} must be all-or-nothing</li>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Concurrent-safe: Batches touching disjoint record sets may run concurrently</li>
 * </ul>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public interface RetryLogStore {

    /**
     * Loads every existing record among the given ids in one round trip.
     *
     * <p><strong>Query Example:</strong></p>
     * <pre>
     * SELECT * FROM retry_log WHERE record_id IN (?, ?, ...);
     * </pre>
     *
     * @param recordIds ids to load (may be empty)
     * @return map of found records keyed by id; ids without a record are absent
     * @throws IllegalArgumentException if recordIds is null
     * @throws RetryPersistenceException if the underlying storage fails
     */
    Map<RecordId, RetryLogRecord> findAllById(Collection<RecordId> recordIds);

    /**
     * Loads a single record.
     *
     * @param recordId the record id
     * @return the record, or empty if none exists
     * @throws IllegalArgumentException if recordId is null
     * @throws RetryPersistenceException if the underlying storage fails
     */
    Optional<RetryLogRecord> findById(RecordId recordId);

    /**
     * Inserts absent records and updates present ones, keyed by record id, as one unit.
     *
     * <p><strong>Transaction Boundary:</strong></p>
     * <pre>
     * BEGIN TRANSACTION;
     *   MERGE INTO retry_log USING (...) ON record_id ...;
     * COMMIT;
     * </pre>
     *
     * <p>Either every record is durably written or none is.</p>
     *
     * @param records records to write (may be empty)
     * @throws IllegalArgumentException if records is null or contains null
     * @throws RetryPersistenceException if the write fails; no record of the batch is persisted
     */
    void upsertAll(Collection<RetryLogRecord> records);

    /**
     * Scans records whose next retry is due.
     *
     * <p><strong>Query Example:</strong></p>
     * <pre>
     * SELECT * FROM retry_log
     * WHERE retry_enabled = true
     *   AND processed = false
     *   AND retry_due_at &lt;= ?
     * ORDER BY retry_due_at ASC
     * LIMIT ?;
     * </pre>
     *
     * @param now reference time
     * @param batchSize maximum number of records to return
     * @return due records ordered by due time (oldest first, may be empty)
     * @throws IllegalArgumentException if now is null or batchSize is not positive
     * @throws RetryPersistenceException if the underlying storage fails
     */
    List<RetryLogRecord> scanDue(Instant now, int batchSize);
}
