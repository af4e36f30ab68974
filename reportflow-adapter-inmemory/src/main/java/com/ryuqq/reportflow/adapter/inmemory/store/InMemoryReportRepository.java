package com.ryuqq.reportflow.adapter.inmemory.store;

import com.ryuqq.reportflow.core.record.ReportRecord;
import com.ryuqq.reportflow.core.record.ReportUpdate;
import com.ryuqq.reportflow.core.spi.ReportRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ReportRepository}.
 *
 * <p>Partial updates are applied inside {@link ConcurrentHashMap#compute}, so concurrent
 * updates to one record never lose each other's fields.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class InMemoryReportRepository implements ReportRepository {

    private final ConcurrentHashMap<String, ReportRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<ReportRecord> findById(String reportId) {
        if (reportId == null) {
            throw new IllegalArgumentException("reportId cannot be null");
        }
        return Optional.ofNullable(records.get(reportId));
    }

    @Override
    public ReportRecord create(ReportRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        ReportRecord existing = records.putIfAbsent(record.id(), record);
        if (existing != null) {
            throw new IllegalStateException("Report already exists: " + record.id());
        }
        return record;
    }

    @Override
    public ReportRecord update(String reportId, ReportUpdate update) {
        if (reportId == null) {
            throw new IllegalArgumentException("reportId cannot be null");
        }
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        ReportRecord updated = records.computeIfPresent(reportId, (id, current) -> update.applyTo(current));
        if (updated == null) {
            throw new NoSuchElementException("Report not found: " + reportId);
        }
        return updated;
    }

    /**
     * Returns all records. Used for test assertions.
     */
    public List<ReportRecord> findAll() {
        return new ArrayList<>(records.values());
    }

    /**
     * Clears all records. Used for test cleanup.
     */
    public void clear() {
        records.clear();
    }
}
