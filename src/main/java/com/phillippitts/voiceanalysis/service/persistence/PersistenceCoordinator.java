package com.phillippitts.voiceanalysis.service.persistence;

import com.phillippitts.voiceanalysis.domain.AnalysisRecord;
import com.phillippitts.voiceanalysis.domain.AnalysisSummary;
import com.phillippitts.voiceanalysis.domain.PredictionChannel;
import com.phillippitts.voiceanalysis.domain.SendStatus;
import com.phillippitts.voiceanalysis.service.store.AnalysisOrder;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Keeps every analysis row paired with exactly one durable audio artifact.
 *
 * <p>Writes for the same id are serialized; writes for different ids run concurrently.
 * Write operations on an unknown id throw
 * {@link com.phillippitts.voiceanalysis.exception.AnalysisNotFoundException}.
 */
public interface PersistenceCoordinator {

    /**
     * Inserts a pending row, copies {@code sourcePath} into the vault under the new id and
     * commits the permanent path. On relocation failure the row is rolled back.
     *
     * @return the committed record, pointing at the vault artifact
     * @throws com.phillippitts.voiceanalysis.exception.ValidationException  blank title or missing source; nothing written
     * @throws com.phillippitts.voiceanalysis.exception.StorageException     insert or commit failed
     * @throws com.phillippitts.voiceanalysis.exception.FileStorageException copy failed; the row was rolled back
     */
    AnalysisRecord createAnalysis(String title, String description, Path sourcePath);

    CompletableFuture<AnalysisRecord> createAnalysisAsync(String title, String description, Path sourcePath);

    /**
     * Removes tags, the row, then the vault directory. A failed directory removal is logged
     * and left for reconciliation; the call still succeeds.
     */
    void deleteAnalysis(long id);

    /**
     * Replaces one channel's map and sets the completion date if it was unset. Other
     * channels are left untouched.
     *
     * @param completedAt completion time, {@code null} for now
     */
    AnalysisRecord applyPredictions(long id, PredictionChannel channel, Map<String, Double> probabilities,
                                    Instant completedAt);

    CompletableFuture<AnalysisRecord> applyPredictionsAsync(long id, PredictionChannel channel,
                                                            Map<String, Double> probabilities, Instant completedAt);

    /**
     * @param feedback {@code null} clears the flag
     * @throws com.phillippitts.voiceanalysis.exception.ValidationException if the channel has no prediction
     */
    AnalysisRecord setFeedback(long id, PredictionChannel channel, Boolean feedback);

    AnalysisRecord markSent(long id);

    AnalysisRecord markError(long id, String message);

    /**
     * Moves a failed analysis back to pending and requests inference again.
     *
     * @throws com.phillippitts.voiceanalysis.exception.ValidationException unless the status is ERROR
     */
    AnalysisRecord retryAnalysis(long id);

    AnalysisRecord updateTags(long id, Collection<String> tagNames);

    /** Every tag name known to the store, alphabetical. */
    List<String> getAllTags();

    Optional<AnalysisRecord> getAnalysisById(long id);

    List<AnalysisRecord> queryAll(AnalysisOrder order, Integer limit);

    List<AnalysisSummary> getRecentAnalyses(int limit);

    List<AnalysisRecord> getAnalysesByStatus(SendStatus status);

    /**
     * Brings one id back to a consistent state using only the id: commits a relocated
     * artifact, finishes an interrupted rollback or removes an orphaned vault directory.
     *
     * @return {@code true} if the id is consistent afterwards
     */
    boolean reconcile(long id);

    /**
     * Reconciles flagged ids and vault directories without a row. Rows older than a few
     * minutes whose audio path is outside their vault directory are repaired too.
     */
    ReconcileSummary reconcileAll();
}
