package com.ryuqq.retry.adapter.inmemory.store;

import com.ryuqq.retry.core.model.RecordId;
import com.ryuqq.retry.core.model.RetryLogRecord;
import com.ryuqq.retry.core.spi.RetryLogStore;
import com.ryuqq.retry.core.spi.RetryPersistenceException;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link RetryLogStore} SPI for testing and reference purposes.
 *
 * <p>This implementation keeps one {@link RetryLogRecord} per {@link RecordId} in a
 * {@link ConcurrentHashMap} and serializes bulk upserts to simulate a transactional MERGE.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>findAllById:</strong> O(K) for K requested ids</li>
 *   <li><strong>upsertAll:</strong> O(K), serialized (one batch at a time)</li>
 *   <li><strong>scanDue:</strong> O(N log N) - full filter + sort by due time</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong> {@link #upsertAll(Collection)} validates the whole batch
 * before writing anything, so a rejected batch leaves the store unchanged.</p>
 *
 * <p><strong>Test Helpers:</strong></p>
 * <ul>
 *   <li>{@link #failNextUpsert(String)}: the next upsertAll throws {@link RetryPersistenceException}</li>
 *   <li>{@link #put(RetryLogRecord)}: seeds a record directly</li>
 *   <li>{@link #bulkFetchCount()} / {@link #upsertCount()}: round-trip counters</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public class InMemoryRetryLogStore implements RetryLogStore {

    private static final Comparator<RetryLogRecord> BY_DUE_TIME = Comparator
        .comparing(RetryLogRecord::retryDueAt)
        .thenComparing(record -> record.recordId().getValue());

    private final ConcurrentHashMap<RecordId, RetryLogRecord> records;
    private final AtomicInteger bulkFetches;
    private final AtomicInteger upserts;
    private volatile String pendingUpsertFailure;

    /**
     * Creates a new InMemoryRetryLogStore with empty storage.
     */
    public InMemoryRetryLogStore() {
        this.records = new ConcurrentHashMap<>();
        this.bulkFetches = new AtomicInteger();
        this.upserts = new AtomicInteger();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Map<RecordId, RetryLogRecord> findAllById(Collection<RecordId> recordIds) {
        if (recordIds == null) {
            throw new IllegalArgumentException("recordIds cannot be null");
        }
        bulkFetches.incrementAndGet();

        Map<RecordId, RetryLogRecord> found = new HashMap<>();
        for (RecordId recordId : recordIds) {
            RetryLogRecord record = records.get(recordId);
            if (record != null) {
                found.put(recordId, record);
            }
        }
        return found;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<RetryLogRecord> findById(RecordId recordId) {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        return Optional.ofNullable(records.get(recordId));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Synchronized: one batch is applied at a time</li>
     *   <li>Whole batch validated before the first write</li>
     *   <li>Insert when absent, replace when present</li>
     * </ul>
     */
    @Override
    public synchronized void upsertAll(Collection<RetryLogRecord> batch) {
        if (batch == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        for (RetryLogRecord record : batch) {
            if (record == null) {
                throw new IllegalArgumentException("records cannot contain null");
            }
        }

        String failure = pendingUpsertFailure;
        if (failure != null) {
            pendingUpsertFailure = null;
            throw new RetryPersistenceException(failure);
        }

        upserts.incrementAndGet();
        for (RetryLogRecord record : batch) {
            records.put(record.recordId(), record);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<RetryLogRecord> scanDue(Instant now, int batchSize) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        return records.values().stream()
            .filter(record -> record.isDue(now))
            .sorted(BY_DUE_TIME)
            .limit(batchSize)
            .collect(Collectors.toList());
    }

    /**
     * Seeds a record directly, bypassing the ledger.
     *
     * @param record the record to store
     * @throws IllegalArgumentException if record is null
     */
    public void put(RetryLogRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        records.put(record.recordId(), record);
    }

    /**
     * Makes the next {@link #upsertAll(Collection)} call fail with {@link RetryPersistenceException}.
     *
     * @param message failure message
     */
    public void failNextUpsert(String message) {
        this.pendingUpsertFailure = message;
    }

    /**
     * Number of stored records.
     *
     * @return record count
     */
    public int size() {
        return records.size();
    }

    /**
     * Number of {@link #findAllById(Collection)} calls so far.
     *
     * @return bulk fetch count
     */
    public int bulkFetchCount() {
        return bulkFetches.get();
    }

    /**
     * Number of successful {@link #upsertAll(Collection)} calls so far.
     *
     * @return upsert count
     */
    public int upsertCount() {
        return upserts.get();
    }

    /**
     * Clears all stored data and counters.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public synchronized void clear() {
        records.clear();
        bulkFetches.set(0);
        upserts.set(0);
        pendingUpsertFailure = null;
    }
}
