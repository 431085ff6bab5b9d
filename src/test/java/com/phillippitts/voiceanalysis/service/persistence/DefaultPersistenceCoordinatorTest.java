package com.phillippitts.voiceanalysis.service.persistence;

import com.phillippitts.voiceanalysis.config.properties.VaultProperties;
import com.phillippitts.voiceanalysis.domain.AnalysisRecord;
import com.phillippitts.voiceanalysis.domain.AnalysisSummary;
import com.phillippitts.voiceanalysis.domain.PredictionChannel;
import com.phillippitts.voiceanalysis.domain.SendStatus;
import com.phillippitts.voiceanalysis.exception.AnalysisNotFoundException;
import com.phillippitts.voiceanalysis.exception.FileStorageException;
import com.phillippitts.voiceanalysis.exception.StorageException;
import com.phillippitts.voiceanalysis.exception.ValidationException;
import com.phillippitts.voiceanalysis.service.metrics.PersistenceMetrics;
import com.phillippitts.voiceanalysis.service.store.AnalysisOrder;
import com.phillippitts.voiceanalysis.service.store.AnalysisUpdate;
import com.phillippitts.voiceanalysis.service.store.JdbcAnalysisStore;
import com.phillippitts.voiceanalysis.service.store.JdbcTagStore;
import com.phillippitts.voiceanalysis.service.vault.FileVault;
import com.phillippitts.voiceanalysis.testutil.EventCapturingPublisher;
import com.phillippitts.voiceanalysis.testutil.SyncExecutor;
import com.phillippitts.voiceanalysis.testutil.TestDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class DefaultPersistenceCoordinatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private EmbeddedDatabase database;
    private JdbcTemplate jdbc;
    private JdbcAnalysisStore store;
    private JdbcTagStore tagStore;
    private FileVault vault;
    private UnresolvedAnalysisRegistry unresolved;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private DefaultPersistenceCoordinator coordinator;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        jdbc = TestDatabase.jdbcTemplate(database);
        store = spy(new JdbcAnalysisStore(jdbc));
        tagStore = new JdbcTagStore(jdbc);
        VaultProperties props = new VaultProperties();
        props.setPrivateDir(tempDir.resolve("vault").toString());
        vault = spy(new FileVault(props));
        unresolved = new UnresolvedAnalysisRegistry();
        publisher = new EventCapturingPublisher();
        meterRegistry = new SimpleMeterRegistry();
        coordinator = newCoordinator(new SyncExecutor());
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private DefaultPersistenceCoordinator newCoordinator(java.util.concurrent.Executor executor) {
        return newCoordinator(executor, T0);
    }

    private DefaultPersistenceCoordinator newCoordinator(java.util.concurrent.Executor executor, Instant now) {
        return new DefaultPersistenceCoordinator(store, tagStore, vault, new IdLockRegistry(), unresolved,
                publisher, new PersistenceMetrics(meterRegistry), executor, Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void createShouldStoreArtifactCommitPathAndPublishEvent() throws IOException {
        Path source = source("take.wav");

        AnalysisRecord created = coordinator.createAnalysis("Morning", "first", source);

        assertThat(created.id()).isPositive();
        assertThat(created.sendStatus()).isEqualTo(SendStatus.PENDING);
        assertThat(created.creationDate()).isEqualTo(T0);
        Path permanent = Paths.get(created.audioPath());
        assertThat(permanent).exists().isEqualTo(vault.directoryFor(created.id()).resolve("recording.wav"));
        assertThat(source).exists();
        assertThat(coordinator.getAnalysisById(created.id()).orElseThrow().audioPath())
                .isEqualTo(created.audioPath());
        assertThat(publisher.eventsOf(AnalysisCreatedEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.analysisId()).isEqualTo(created.id());
                    assertThat(e.audioPath()).isEqualTo(permanent);
                });
        assertThat(meterRegistry.find("voiceanalysis.persistence.create").tag("outcome", "committed").timer())
                .isNotNull();
    }

    @Test
    void createShouldRejectBlankTitleOrMissingSourceWithoutTouchingStorage() throws IOException {
        Path source = source("a.wav");

        assertThatThrownBy(() -> coordinator.createAnalysis(" ", null, source))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> coordinator.createAnalysis("t", null, tempDir.resolve("missing.wav")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> coordinator.createAnalysis("t", null, null))
                .isInstanceOf(ValidationException.class);

        assertThat(rowCount()).isZero();
        assertThat(vault.listVaultIds()).isEmpty();
    }

    @Test
    void failedRelocationShouldRollBackRowAndPartialDirectory() throws IOException {
        Path source = source("a.wav");
        doThrow(new FileStorageException("disk full")).when(vault).store(any(), anyLong());

        assertThatThrownBy(() -> coordinator.createAnalysis("t", null, source))
                .isInstanceOf(FileStorageException.class)
                .hasMessageContaining("disk full");

        assertThat(rowCount()).isZero();
        assertThat(vault.listVaultIds()).isEmpty();
        assertThat(unresolved.size()).isZero();
        assertThat(publisher.eventsOf(AnalysisCreatedEvent.class)).isEmpty();
    }

    @Test
    void incompleteRollbackShouldBeFlaggedAndFinishedByReconcile() throws IOException {
        Path source = source("a.wav");
        doThrow(new FileStorageException("disk full")).when(vault).store(any(), anyLong());
        doThrow(new FileStorageException("busy")).when(vault).delete(anyLong());

        assertThatThrownBy(() -> coordinator.createAnalysis("t", null, source))
                .isInstanceOf(FileStorageException.class);

        UnresolvedAnalysisRegistry.Entry entry = unresolved.snapshot().get(0);
        assertThat(entry.kind()).isEqualTo(UnresolvedAnalysisRegistry.Kind.ROLLBACK_PENDING);

        doCallRealMethod().when(vault).delete(anyLong());
        assertThat(coordinator.reconcile(entry.analysisId())).isTrue();
        assertThat(unresolved.isFlagged(entry.analysisId())).isFalse();
        assertThat(rowCount()).isZero();
    }

    @Test
    void failedCommitShouldFlagIdAndReconcileShouldCommitArtifactPath() throws IOException {
        Path source = source("a.wav");
        doThrow(new StorageException("database unavailable")).when(store).update(anyLong(), any(AnalysisUpdate.class));

        assertThatThrownBy(() -> coordinator.createAnalysis("t", null, source))
                .isInstanceOf(StorageException.class);

        UnresolvedAnalysisRegistry.Entry entry = unresolved.snapshot().get(0);
        long id = entry.analysisId();
        assertThat(entry.kind()).isEqualTo(UnresolvedAnalysisRegistry.Kind.UNCOMMITTED);
        assertThat(store.getById(id).orElseThrow().audioPath()).isEqualTo(source.toString());

        // Still failing: the flag must survive
        assertThat(coordinator.reconcile(id)).isFalse();
        assertThat(unresolved.isFlagged(id)).isTrue();

        doCallRealMethod().when(store).update(anyLong(), any(AnalysisUpdate.class));
        assertThat(coordinator.reconcile(id)).isTrue();
        assertThat(unresolved.isFlagged(id)).isFalse();
        assertThat(store.getById(id).orElseThrow().audioPath())
                .isEqualTo(vault.findArtifact(id).orElseThrow().toString());
    }

    @Test
    void reconcileAllAfterRestartShouldCommitRowLeftOnTempPath() throws IOException {
        Path source = source("a.wav");
        doThrow(new StorageException("database unavailable")).when(store).update(anyLong(), any(AnalysisUpdate.class));
        assertThatThrownBy(() -> coordinator.createAnalysis("t", null, source))
                .isInstanceOf(StorageException.class);
        long id = unresolved.snapshot().get(0).analysisId();
        doCallRealMethod().when(store).update(anyLong(), any(AnalysisUpdate.class));

        // Fresh registry: the flags did not survive the restart
        unresolved = new UnresolvedAnalysisRegistry();
        DefaultPersistenceCoordinator restarted = newCoordinator(new SyncExecutor(),
                T0.plus(DefaultPersistenceCoordinator.MISPLACED_GRACE).plusSeconds(1));

        ReconcileSummary summary = restarted.reconcileAll();

        assertThat(summary.repaired()).isEqualTo(1);
        assertThat(summary.unresolved()).isZero();
        assertThat(store.getById(id).orElseThrow().audioPath())
                .isEqualTo(vault.findArtifact(id).orElseThrow().toString());
    }

    @Test
    void reconcileAllShouldDeleteStaleRowWithoutArtifact() {
        long id = store.insert(AnalysisRecord.pending("lost", null, tempDir.resolve("gone.wav").toString(),
                T0.minus(Duration.ofHours(1))));

        ReconcileSummary summary = coordinator.reconcileAll();

        assertThat(summary.examined()).isEqualTo(1);
        assertThat(summary.repaired()).isEqualTo(1);
        assertThat(store.exists(id)).isFalse();
    }

    @Test
    void reconcileAllShouldLeaveRecentRowOutsideVaultAlone() {
        long id = store.insert(AnalysisRecord.pending("in flight", null, tempDir.resolve("take.wav").toString(),
                T0.minusSeconds(30)));

        assertThat(coordinator.reconcileAll()).isEqualTo(new ReconcileSummary(0, 0, 0));
        assertThat(store.exists(id)).isTrue();
    }

    @Test
    void deleteShouldRemoveTagsRowAndDirectory() throws IOException {
        AnalysisRecord created = coordinator.createAnalysis("t", null, source("a.wav"));
        coordinator.updateTags(created.id(), List.of("one", "two"));

        coordinator.deleteAnalysis(created.id());

        assertThat(coordinator.getAnalysisById(created.id())).isEmpty();
        assertThat(vault.directoryFor(created.id())).doesNotExist();
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM ANALYSIS_TAG", Integer.class)).isZero();
    }

    @Test
    void deleteOfUnknownIdShouldThrowNotFound() {
        assertThatThrownBy(() -> coordinator.deleteAnalysis(42))
                .isInstanceOf(AnalysisNotFoundException.class)
                .hasMessageContaining("42");
    }

    @Test
    void undeletableDirectoryShouldBeFlaggedAsOrphanAndSweptLater() throws IOException {
        AnalysisRecord created = coordinator.createAnalysis("t", null, source("a.wav"));
        long id = created.id();
        doThrow(new FileStorageException("locked")).when(vault).delete(id);

        coordinator.deleteAnalysis(id);

        assertThat(coordinator.getAnalysisById(id)).isEmpty();
        assertThat(unresolved.get(id)).hasValueSatisfying(
                e -> assertThat(e.kind()).isEqualTo(UnresolvedAnalysisRegistry.Kind.ORPHANED));
        assertThat(vault.directoryFor(id)).exists();

        doCallRealMethod().when(vault).delete(anyLong());
        ReconcileSummary summary = coordinator.reconcileAll();

        assertThat(summary.repaired()).isEqualTo(1);
        assertThat(summary.unresolved()).isZero();
        assertThat(vault.directoryFor(id)).doesNotExist();
    }

    @Test
    void reconcileAllShouldRemoveVaultDirectoriesWithoutRows() throws IOException {
        vault.store(source("stray.wav"), 999);

        ReconcileSummary summary = coordinator.reconcileAll();

        assertThat(summary.examined()).isEqualTo(1);
        assertThat(summary.repaired()).isEqualTo(1);
        assertThat(vault.listVaultIds()).isEmpty();
    }

    @Test
    void reconcileShouldDropRowWhoseArtifactNeverArrived() {
        long id = store.insert(AnalysisRecord.pending("t", null, "/tmp/gone.wav", T0));

        assertThat(coordinator.reconcile(id)).isTrue();

        assertThat(store.exists(id)).isFalse();
    }

    @Test
    void reconcileAllShouldBeNoOpWhenConsistent() throws IOException {
        coordinator.createAnalysis("t", null, source("a.wav"));

        assertThat(coordinator.reconcileAll()).isEqualTo(new ReconcileSummary(0, 0, 0));
    }

    @Test
    void applyPredictionsShouldSetCompletionDateOnlyOnce() throws IOException {
        long id = coordinator.createAnalysis("t", null, source("a.wav")).id();
        Instant first = T0.plusSeconds(30);

        coordinator.applyPredictions(id, PredictionChannel.AGE, Map.of("20-29", 70.0, "30-39", 30.0), first);
        AnalysisRecord updated = coordinator.applyPredictions(id, PredictionChannel.GENDER,
                Map.of("male", 55.0), T0.plusSeconds(90));

        assertThat(updated.completionDate()).isEqualTo(first);
        assertThat(updated.prediction(PredictionChannel.AGE)).containsEntry("20-29", 70.0);
        assertThat(updated.prediction(PredictionChannel.GENDER)).containsEntry("male", 55.0);
        assertThat(meterRegistry.counter("voiceanalysis.persistence.prediction", "channel", "AGE").count())
                .isEqualTo(1.0);
    }

    @Test
    void applyPredictionsShouldRejectInvalidMaps() throws IOException {
        long id = coordinator.createAnalysis("t", null, source("a.wav")).id();

        assertThatThrownBy(() -> coordinator.applyPredictions(id, PredictionChannel.AGE, Map.of("a", 100.5), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> coordinator.applyPredictions(id, PredictionChannel.AGE, Map.of("a", -1.0), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> coordinator.applyPredictions(id, PredictionChannel.AGE, Map.of("a", Double.NaN), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> coordinator.applyPredictions(id, PredictionChannel.AGE, Map.of("a,b", 5.0), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> coordinator.applyPredictions(id, PredictionChannel.AGE, null, null))
                .isInstanceOf(ValidationException.class);

        assertThat(coordinator.getAnalysisById(id).orElseThrow().channels()).isEmpty();
    }

    @Test
    void applyPredictionsToUnknownIdShouldThrowNotFound() {
        assertThatThrownBy(() -> coordinator.applyPredictions(7, PredictionChannel.AGE, Map.of("a", 1.0), null))
                .isInstanceOf(AnalysisNotFoundException.class);
    }

    @Test
    void concurrentChannelUpdatesShouldAllSurvive() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            DefaultPersistenceCoordinator concurrent = newCoordinator(pool);
            List<Long> ids = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                ids.add(concurrent.createAnalysis("t" + i, null, source("a" + i + ".wav")).id());
            }

            List<CompletableFuture<AnalysisRecord>> futures = new ArrayList<>();
            for (long id : ids) {
                futures.add(concurrent.applyPredictionsAsync(id, PredictionChannel.AGE, Map.of("20-29", 80.0), null));
                futures.add(concurrent.applyPredictionsAsync(id, PredictionChannel.GENDER, Map.of("female", 65.0), null));
                futures.add(concurrent.applyPredictionsAsync(id, PredictionChannel.EMOTION, Map.of("calm", 40.0), null));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

            for (long id : ids) {
                AnalysisRecord record = concurrent.getAnalysisById(id).orElseThrow();
                assertThat(record.channels()).containsOnlyKeys(
                        PredictionChannel.AGE, PredictionChannel.GENDER, PredictionChannel.EMOTION);
                assertThat(record.completionDate()).isNotNull();
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void feedbackShouldRequireExistingPrediction() throws IOException {
        long id = coordinator.createAnalysis("t", null, source("a.wav")).id();

        assertThatThrownBy(() -> coordinator.setFeedback(id, PredictionChannel.NATIONALITY, true))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("NATIONALITY");

        coordinator.applyPredictions(id, PredictionChannel.NATIONALITY, Map.of("FR", 60.0), null);
        assertThat(coordinator.setFeedback(id, PredictionChannel.NATIONALITY, false)
                .feedback(PredictionChannel.NATIONALITY)).isFalse();
        assertThat(coordinator.setFeedback(id, PredictionChannel.NATIONALITY, null)
                .feedback(PredictionChannel.NATIONALITY)).isNull();
    }

    @Test
    void markErrorThenRetryShouldReturnToPendingAndRepublish() throws IOException {
        long id = coordinator.createAnalysis("t", null, source("a.wav")).id();
        publisher.clear();

        AnalysisRecord failed = coordinator.markError(id, "model offline");
        assertThat(failed.sendStatus()).isEqualTo(SendStatus.ERROR);
        assertThat(failed.errorMessage()).isEqualTo("model offline");

        AnalysisRecord retried = coordinator.retryAnalysis(id);

        assertThat(retried.sendStatus()).isEqualTo(SendStatus.PENDING);
        assertThat(retried.errorMessage()).isNull();
        assertThat(publisher.eventsOf(AnalysisCreatedEvent.class)).hasSize(1);
    }

    @Test
    void retryShouldOnlyBeAllowedFromError() throws IOException {
        long id = coordinator.createAnalysis("t", null, source("a.wav")).id();
        coordinator.markSent(id);

        assertThatThrownBy(() -> coordinator.retryAnalysis(id)).isInstanceOf(ValidationException.class);
    }

    @Test
    void markSentShouldClearPreviousError() throws IOException {
        long id = coordinator.createAnalysis("t", null, source("a.wav")).id();
        coordinator.markError(id, "transient");

        AnalysisRecord sent = coordinator.markSent(id);

        assertThat(sent.sendStatus()).isEqualTo(SendStatus.SENT);
        assertThat(sent.errorMessage()).isNull();
        assertThat(coordinator.getAnalysesByStatus(SendStatus.SENT)).extracting(AnalysisRecord::id).containsExactly(id);
    }

    @Test
    void tagsShouldBeReturnedWithRecords() throws IOException {
        long id = coordinator.createAnalysis("t", null, source("a.wav")).id();

        AnalysisRecord tagged = coordinator.updateTags(id, List.of("interview", "draft"));

        assertThat(tagged.tags()).containsExactly("draft", "interview");
        assertThat(coordinator.queryAll(AnalysisOrder.ID_ASC, null).get(0).tags()).containsExactly("draft", "interview");
    }

    @Test
    void allTagsShouldBeSortedAndDistinct() throws IOException {
        long first = coordinator.createAnalysis("a", null, source("a.wav")).id();
        long second = coordinator.createAnalysis("b", null, source("b.wav")).id();
        coordinator.updateTags(first, List.of("work", "calm"));
        coordinator.updateTags(second, List.of("calm", "archive"));

        assertThat(coordinator.getAllTags()).containsExactly("archive", "calm", "work");
    }

    @Test
    void recentAnalysesShouldSummarizeStatus() throws IOException {
        long pending = coordinator.createAnalysis("pending", null, source("a.wav")).id();
        long failed = coordinator.createAnalysis("failed", null, source("b.wav")).id();
        long done = coordinator.createAnalysis("done", null, source("c.wav")).id();
        coordinator.markError(failed, "x");
        coordinator.applyPredictions(done, PredictionChannel.EMOTION, Map.of("happy", 90.0), null);

        List<AnalysisSummary> recent = coordinator.getRecentAnalyses(5);

        assertThat(recent).extracting(AnalysisSummary::id).containsExactly(done, failed, pending);
        assertThat(recent).extracting(AnalysisSummary::status).containsExactly("Completed", "Failed", "Pending");
        assertThat(coordinator.getRecentAnalyses(1)).hasSize(1);
        assertThatThrownBy(() -> coordinator.getRecentAnalyses(0)).isInstanceOf(ValidationException.class);
    }

    @Test
    void queryAllShouldRejectNegativeLimit() {
        assertThatThrownBy(() -> coordinator.queryAll(AnalysisOrder.ID_ASC, -1))
                .isInstanceOf(ValidationException.class);
    }

    private Path source(String name) throws IOException {
        return Files.write(tempDir.resolve(name), new byte[] {1, 2, 3, 4});
    }

    private int rowCount() {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM AUDIO_ANALYSIS", Integer.class);
        return count == null ? 0 : count;
    }
}
