package com.phillippitts.voiceanalysis.service.persistence;

import com.phillippitts.voiceanalysis.domain.AnalysisRecord;
import com.phillippitts.voiceanalysis.domain.AnalysisSummary;
import com.phillippitts.voiceanalysis.domain.PredictionChannel;
import com.phillippitts.voiceanalysis.domain.SendStatus;
import com.phillippitts.voiceanalysis.domain.Tag;
import com.phillippitts.voiceanalysis.exception.AnalysisNotFoundException;
import com.phillippitts.voiceanalysis.exception.FileStorageException;
import com.phillippitts.voiceanalysis.exception.StorageException;
import com.phillippitts.voiceanalysis.exception.ValidationException;
import com.phillippitts.voiceanalysis.service.codec.ProbabilityMapCodec;
import com.phillippitts.voiceanalysis.service.metrics.PersistenceMetrics;
import com.phillippitts.voiceanalysis.service.store.AnalysisOrder;
import com.phillippitts.voiceanalysis.service.store.AnalysisStore;
import com.phillippitts.voiceanalysis.service.store.AnalysisUpdate;
import com.phillippitts.voiceanalysis.service.store.TagStore;
import com.phillippitts.voiceanalysis.service.vault.FileVault;
import com.phillippitts.voiceanalysis.util.LogSanitizer;
import com.phillippitts.voiceanalysis.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Default {@link PersistenceCoordinator} over an {@link AnalysisStore}, a {@link TagStore}
 * and a {@link FileVault}.
 *
 * <p><b>Create:</b> insert, relocate, commit. A failed relocation is compensated by
 * deleting the row and the partial vault directory. A failed commit leaves the id flagged
 * in the {@link UnresolvedAnalysisRegistry} so {@link #reconcile(long)} can finish it.
 *
 * <p><b>Concurrency:</b> every write runs under the id's lock from {@link IdLockRegistry}.
 * Reads are not locked; each read is a single statement.
 */
public class DefaultPersistenceCoordinator implements PersistenceCoordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultPersistenceCoordinator.class);

    static final double MIN_CONFIDENCE = 0.0;
    static final double MAX_CONFIDENCE = 100.0;

    /** Rows younger than this may still be inside a running create and are left alone by sweeps. */
    static final Duration MISPLACED_GRACE = Duration.ofMinutes(5);

    private final AnalysisStore store;
    private final TagStore tagStore;
    private final FileVault vault;
    private final IdLockRegistry locks;
    private final UnresolvedAnalysisRegistry unresolved;
    private final ApplicationEventPublisher publisher;
    private final PersistenceMetrics metrics;
    private final Executor executor;
    private final Clock clock;

    public DefaultPersistenceCoordinator(AnalysisStore store,
                                         TagStore tagStore,
                                         FileVault vault,
                                         IdLockRegistry locks,
                                         UnresolvedAnalysisRegistry unresolved,
                                         ApplicationEventPublisher publisher,
                                         PersistenceMetrics metrics,
                                         Executor executor,
                                         Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.tagStore = Objects.requireNonNull(tagStore, "tagStore must not be null");
        this.vault = Objects.requireNonNull(vault, "vault must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.unresolved = Objects.requireNonNull(unresolved, "unresolved must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public AnalysisRecord createAnalysis(String title, String description, Path sourcePath) {
        long start = System.nanoTime();
        try {
            validateCreate(title, sourcePath);
        } catch (ValidationException e) {
            metrics.recordCreate("rejected", System.nanoTime() - start);
            throw e;
        }

        AnalysisRecord pending = AnalysisRecord.pending(title, description, sourcePath.toString(), clock.instant());
        long id = store.insert(pending);

        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("analysisId", String.valueOf(id))) {
            AnalysisRecord committed = locks.withLock(id, () -> relocateAndCommit(pending.withId(id), sourcePath, start));
            LOG.info("Created analysis {} '{}' -> {} in {} ms", id, LogSanitizer.title(title),
                    LogSanitizer.fileName(Paths.get(committed.audioPath())), TimeUtils.elapsedMillis(start));
            metrics.recordCreate("committed", System.nanoTime() - start);
            publisher.publishEvent(new AnalysisCreatedEvent(id, Paths.get(committed.audioPath()), clock.instant()));
            return committed;
        }
    }

    private AnalysisRecord relocateAndCommit(AnalysisRecord inserted, Path sourcePath, long start) {
        long id = inserted.id();
        Path permanent;
        try {
            permanent = vault.store(sourcePath, id);
        } catch (RuntimeException e) {
            rollback(id, e);
            metrics.recordCreate("rolled_back", System.nanoTime() - start);
            throw e;
        }

        boolean committed;
        try {
            committed = store.update(id, AnalysisUpdate.builder().audioPath(permanent.toString()).build());
        } catch (StorageException e) {
            unresolved.flagUncommitted(id, permanent.toString(), "commit failed: " + e.getMessage());
            metrics.recordCreate("unresolved", System.nanoTime() - start);
            LOG.error("Analysis {} relocated to {} but the path was not committed; flagged for reconciliation",
                    id, permanent, e);
            throw e;
        }
        if (!committed) {
            unresolved.flagUncommitted(id, permanent.toString(), "commit affected no row");
            metrics.recordCreate("unresolved", System.nanoTime() - start);
            throw new StorageException("Commit of analysis " + id + " affected no row");
        }
        return inserted.withAudioPath(permanent.toString());
    }

    private void rollback(long id, RuntimeException cause) {
        LOG.warn("Relocation failed for analysis {}; rolling back: {}", id, cause.getMessage());
        boolean complete = true;
        try {
            vault.delete(id);
        } catch (RuntimeException e) {
            complete = false;
            cause.addSuppressed(e);
        }
        try {
            tagStore.deleteForAnalysis(id);
            store.delete(id);
        } catch (RuntimeException e) {
            complete = false;
            cause.addSuppressed(e);
        }
        if (!complete) {
            unresolved.flagRollbackPending(id, "rollback incomplete: " + cause.getMessage());
            LOG.error("Rollback of analysis {} incomplete; flagged for reconciliation", id);
        }
    }

    private static void validateCreate(String title, Path sourcePath) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title", "must not be blank");
        }
        if (sourcePath == null) {
            throw new ValidationException("sourcePath", "must not be null");
        }
        if (!Files.isRegularFile(sourcePath)) {
            throw new ValidationException("sourcePath", "file does not exist: " + LogSanitizer.fileName(sourcePath));
        }
    }

    @Override
    public CompletableFuture<AnalysisRecord> createAnalysisAsync(String title, String description, Path sourcePath) {
        return CompletableFuture.supplyAsync(() -> createAnalysis(title, description, sourcePath), executor);
    }

    @Override
    public void deleteAnalysis(long id) {
        locks.withLock(id, () -> {
            if (!store.exists(id)) {
                throw new AnalysisNotFoundException(id);
            }
            tagStore.deleteForAnalysis(id);
            store.delete(id);
            try {
                vault.delete(id);
                unresolved.resolve(id);
                metrics.incrementDelete("deleted");
                LOG.info("Deleted analysis {}", id);
            } catch (FileStorageException e) {
                unresolved.flagOrphaned(id, e.getMessage());
                metrics.incrementDelete("orphaned");
                LOG.warn("Analysis {} deleted but its vault directory remains; flagged as orphan: {}",
                        id, e.getMessage());
            }
        });
    }

    @Override
    public AnalysisRecord applyPredictions(long id, PredictionChannel channel, Map<String, Double> probabilities,
                                           Instant completedAt) {
        Objects.requireNonNull(channel, "channel must not be null");
        validateProbabilities(channel, probabilities);
        return locks.withLock(id, () -> {
            AnalysisRecord current = require(id);
            AnalysisUpdate.Builder update = AnalysisUpdate.builder().prediction(channel, probabilities);
            if (current.completionDate() == null) {
                update.completionDate(completedAt != null ? completedAt : clock.instant());
            }
            store.update(id, update.build());
            metrics.incrementPrediction(channel.name());
            LOG.debug("Applied {} prediction ({} labels) to analysis {}", channel, probabilities.size(), id);
            return reload(id);
        });
    }

    private static void validateProbabilities(PredictionChannel channel, Map<String, Double> probabilities) {
        String field = channel.name().toLowerCase(Locale.ROOT);
        if (probabilities == null) {
            throw new ValidationException(field, "prediction map must not be null");
        }
        for (Map.Entry<String, Double> entry : probabilities.entrySet()) {
            Double value = entry.getValue();
            if (value == null || !Double.isFinite(value) || value < MIN_CONFIDENCE || value > MAX_CONFIDENCE) {
                throw new ValidationException(field,
                        "confidence for '" + entry.getKey() + "' must be within [0, 100]: " + value);
            }
        }
        try {
            ProbabilityMapCodec.encode(probabilities);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field, e.getMessage());
        }
    }

    @Override
    public CompletableFuture<AnalysisRecord> applyPredictionsAsync(long id, PredictionChannel channel,
                                                                   Map<String, Double> probabilities,
                                                                   Instant completedAt) {
        return CompletableFuture.supplyAsync(() -> applyPredictions(id, channel, probabilities, completedAt), executor);
    }

    @Override
    public AnalysisRecord setFeedback(long id, PredictionChannel channel, Boolean feedback) {
        Objects.requireNonNull(channel, "channel must not be null");
        return locks.withLock(id, () -> {
            AnalysisRecord current = require(id);
            if (current.prediction(channel) == null) {
                throw new ValidationException("feedback", channel + " has no prediction to give feedback on");
            }
            store.update(id, AnalysisUpdate.builder().feedback(channel, feedback).build());
            return reload(id);
        });
    }

    @Override
    public AnalysisRecord markSent(long id) {
        return locks.withLock(id, () -> {
            require(id);
            store.update(id, AnalysisUpdate.builder().sendStatus(SendStatus.SENT).errorMessage(null).build());
            return reload(id);
        });
    }

    @Override
    public AnalysisRecord markError(long id, String message) {
        return locks.withLock(id, () -> {
            require(id);
            store.update(id, AnalysisUpdate.builder().sendStatus(SendStatus.ERROR).errorMessage(message).build());
            LOG.warn("Analysis {} marked as failed: {}", id, message);
            return reload(id);
        });
    }

    @Override
    public AnalysisRecord retryAnalysis(long id) {
        AnalysisRecord retried = locks.withLock(id, () -> {
            AnalysisRecord current = require(id);
            if (current.sendStatus() != SendStatus.ERROR) {
                throw new ValidationException("sendStatus",
                        "only failed analyses can be retried (current: " + current.sendStatus() + ")");
            }
            store.update(id, AnalysisUpdate.builder().sendStatus(SendStatus.PENDING).errorMessage(null).build());
            return reload(id);
        });
        LOG.info("Retrying analysis {}", id);
        publisher.publishEvent(new AnalysisCreatedEvent(id, Paths.get(retried.audioPath()), clock.instant()));
        return retried;
    }

    @Override
    public AnalysisRecord updateTags(long id, Collection<String> tagNames) {
        return locks.withLock(id, () -> {
            require(id);
            tagStore.replaceTags(id, tagNames);
            return reload(id);
        });
    }

    @Override
    public List<String> getAllTags() {
        return tagStore.findAll().stream().map(Tag::name).sorted().toList();
    }

    @Override
    public Optional<AnalysisRecord> getAnalysisById(long id) {
        return store.getById(id).map(this::withTags);
    }

    @Override
    public List<AnalysisRecord> queryAll(AnalysisOrder order, Integer limit) {
        if (limit != null && limit < 0) {
            throw new ValidationException("limit", "must not be negative");
        }
        return store.queryAll(order, limit).stream().map(this::withTags).toList();
    }

    @Override
    public List<AnalysisSummary> getRecentAnalyses(int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit", "must be positive");
        }
        return store.queryAll(AnalysisOrder.CREATION_DATE_DESC, limit).stream()
                .map(AnalysisSummary::from)
                .toList();
    }

    @Override
    public List<AnalysisRecord> getAnalysesByStatus(SendStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        return store.findByStatus(status).stream().map(this::withTags).toList();
    }

    @Override
    public boolean reconcile(long id) {
        return locks.withLock(id, () -> {
            try {
                boolean repaired = repair(id);
                if (repaired) {
                    unresolved.resolve(id);
                }
                return repaired;
            } catch (RuntimeException e) {
                LOG.warn("Reconciliation of analysis {} failed: {}", id, e.getMessage());
                return false;
            }
        });
    }

    /**
     * @return {@code true} once the id is consistent
     */
    private boolean repair(long id) {
        Optional<UnresolvedAnalysisRegistry.Entry> flag = unresolved.get(id);
        Optional<AnalysisRecord> row = store.getById(id);

        if (flag.isPresent() && flag.get().kind() == UnresolvedAnalysisRegistry.Kind.ROLLBACK_PENDING) {
            vault.delete(id);
            tagStore.deleteForAnalysis(id);
            store.delete(id);
            LOG.info("Finished rollback of analysis {}", id);
            metrics.incrementReconciled("rollback");
            return true;
        }

        if (row.isEmpty()) {
            if (vault.delete(id)) {
                LOG.info("Removed orphaned vault directory for analysis {}", id);
                metrics.incrementReconciled("orphan");
            }
            return true;
        }

        Optional<Path> artifact = vault.findArtifact(id);
        if (artifact.isEmpty()) {
            // Row without an artifact: the create never got past relocation
            tagStore.deleteForAnalysis(id);
            store.delete(id);
            LOG.warn("Analysis {} had no audio artifact; removed the row", id);
            metrics.incrementReconciled("rollback");
            return true;
        }

        String permanent = artifact.get().toString();
        if (!permanent.equals(row.get().audioPath())) {
            if (!store.update(id, AnalysisUpdate.builder().audioPath(permanent).build())) {
                return false;
            }
            LOG.info("Committed permanent path for analysis {}", id);
            metrics.incrementReconciled("commit");
        }
        return true;
    }

    /**
     * Ids whose stored path is outside their vault directory. Covers creates that stopped
     * before a restart, when the in-memory flags are gone.
     */
    private List<Long> misplacedRows() {
        Instant cutoff = clock.instant().minus(MISPLACED_GRACE);
        return store.queryAll(AnalysisOrder.ID_ASC, null).stream()
                .filter(row -> row.creationDate().isBefore(cutoff))
                .filter(row -> !isInVault(row))
                .map(AnalysisRecord::id)
                .toList();
    }

    private boolean isInVault(AnalysisRecord row) {
        try {
            return Paths.get(row.audioPath()).toAbsolutePath().normalize().startsWith(vault.directoryFor(row.id()));
        } catch (InvalidPathException e) {
            LOG.warn("Analysis {} has an unreadable audio path: {}", row.id(), e.getMessage());
            return false;
        }
    }

    @Override
    public ReconcileSummary reconcileAll() {
        Set<Long> candidates = new LinkedHashSet<>();
        unresolved.snapshot().forEach(entry -> candidates.add(entry.analysisId()));
        for (Long vaultId : vault.listVaultIds()) {
            if (!store.exists(vaultId)) {
                candidates.add(vaultId);
            }
        }
        candidates.addAll(misplacedRows());
        int repaired = 0;
        for (Long id : candidates) {
            if (reconcile(id)) {
                repaired++;
            }
        }
        ReconcileSummary summary = new ReconcileSummary(candidates.size(), repaired, unresolved.size());
        if (!candidates.isEmpty()) {
            LOG.info("Reconciliation examined {} id(s), repaired {}, {} still unresolved",
                    summary.examined(), summary.repaired(), summary.unresolved());
        }
        return summary;
    }

    private AnalysisRecord require(long id) {
        return store.getById(id).orElseThrow(() -> new AnalysisNotFoundException(id));
    }

    private AnalysisRecord reload(long id) {
        return withTags(require(id));
    }

    private AnalysisRecord withTags(AnalysisRecord record) {
        return record.withTags(tagStore.findByAnalysisId(record.id()));
    }
}
