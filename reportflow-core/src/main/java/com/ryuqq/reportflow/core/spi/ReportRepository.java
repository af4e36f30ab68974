package com.ryuqq.reportflow.core.spi;

import com.ryuqq.reportflow.core.record.ReportRecord;
import com.ryuqq.reportflow.core.record.ReportUpdate;

import java.util.Optional;

/**
 * Record store for report records.
 *
 * <p>Updates are scoped to one record id; fields absent from the {@link ReportUpdate}
 * are left untouched. Concurrent writers to the same id resolve last-writer-wins.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public interface ReportRepository {

    Optional<ReportRecord> findById(String reportId);

    /**
     * @throws IllegalStateException if a record with the same id exists
     */
    ReportRecord create(ReportRecord record);

    /**
     * Applies a partial update.
     *
     * @param reportId record id
     * @param update fields to write
     * @return the updated record
     * @throws java.util.NoSuchElementException if no record has the id
     */
    ReportRecord update(String reportId, ReportUpdate update);
}
