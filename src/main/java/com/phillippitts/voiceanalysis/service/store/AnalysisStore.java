package com.phillippitts.voiceanalysis.service.store;

import com.phillippitts.voiceanalysis.domain.AnalysisRecord;
import com.phillippitts.voiceanalysis.domain.SendStatus;

import java.util.List;
import java.util.Optional;

/**
 * Row-level access to analysis records. The store is the only component that assigns ids.
 *
 * <p>Every method is a single SQL statement, so an update of some fields is atomic with
 * respect to other statements on the same row. Read-modify-write sequences across calls
 * are the caller's responsibility.
 *
 * <p>All failures surface as {@link com.phillippitts.voiceanalysis.exception.StorageException}.
 * Tags are not part of the row; see {@link TagStore}.
 */
public interface AnalysisStore {

    /**
     * Inserts a new row and returns its generated id. The record's own id must be {@code null}.
     */
    long insert(AnalysisRecord record);

    /**
     * Applies the set fields of {@code update}.
     *
     * @return {@code false} if no row has this id
     */
    boolean update(long id, AnalysisUpdate update);

    Optional<AnalysisRecord> getById(long id);

    /**
     * @param order ordering, {@code null} for newest first
     * @param limit maximum rows, {@code null} for all
     */
    List<AnalysisRecord> queryAll(AnalysisOrder order, Integer limit);

    List<AnalysisRecord> findByStatus(SendStatus status);

    /**
     * @return {@code false} if no row has this id
     */
    boolean delete(long id);

    boolean exists(long id);
}
