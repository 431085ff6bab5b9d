package com.phillippitts.voiceanalysis.config;

import com.phillippitts.voiceanalysis.config.properties.RecordingProperties;
import com.phillippitts.voiceanalysis.config.properties.VaultProperties;
import com.phillippitts.voiceanalysis.service.inference.InferenceClient;
import com.phillippitts.voiceanalysis.service.inference.InferenceDispatcher;
import com.phillippitts.voiceanalysis.service.metrics.PersistenceMetrics;
import com.phillippitts.voiceanalysis.service.persistence.DefaultPersistenceCoordinator;
import com.phillippitts.voiceanalysis.service.persistence.IdLockRegistry;
import com.phillippitts.voiceanalysis.service.persistence.PersistenceCoordinator;
import com.phillippitts.voiceanalysis.service.persistence.UnresolvedAnalysisRegistry;
import com.phillippitts.voiceanalysis.service.reconcile.VaultReconciler;
import com.phillippitts.voiceanalysis.service.recording.TempRecordingFiles;
import com.phillippitts.voiceanalysis.service.store.AnalysisStore;
import com.phillippitts.voiceanalysis.service.store.TagStore;
import com.phillippitts.voiceanalysis.service.upload.UploadService;
import com.phillippitts.voiceanalysis.service.vault.FileVault;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the persistence pipeline: vault, coordinator, inference dispatch, uploads and
 * background reconciliation.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FileVault fileVault(VaultProperties vaultProperties) {
        return new FileVault(vaultProperties);
    }

    @Bean
    public IdLockRegistry idLockRegistry() {
        return new IdLockRegistry();
    }

    @Bean
    public UnresolvedAnalysisRegistry unresolvedAnalysisRegistry() {
        return new UnresolvedAnalysisRegistry();
    }

    @Bean
    public PersistenceCoordinator persistenceCoordinator(AnalysisStore analysisStore,
                                                         TagStore tagStore,
                                                         FileVault fileVault,
                                                         IdLockRegistry idLockRegistry,
                                                         UnresolvedAnalysisRegistry unresolved,
                                                         ApplicationEventPublisher publisher,
                                                         PersistenceMetrics metrics,
                                                         @Qualifier("persistenceExecutor") Executor executor,
                                                         Clock clock) {
        return new DefaultPersistenceCoordinator(analysisStore, tagStore, fileVault, idLockRegistry,
                unresolved, publisher, metrics, executor, clock);
    }

    /**
     * Dispatches new analyses to an {@link InferenceClient} when one is registered.
     */
    @Bean
    public InferenceDispatcher inferenceDispatcher(PersistenceCoordinator coordinator,
                                                   ObjectProvider<InferenceClient> inferenceClient,
                                                   @Qualifier("inferenceExecutor") Executor executor) {
        return new InferenceDispatcher(coordinator, inferenceClient, executor);
    }

    @Bean
    public TempRecordingFiles tempRecordingFiles(RecordingProperties recordingProperties) {
        return new TempRecordingFiles(recordingProperties);
    }

    @Bean
    public UploadService uploadService(PersistenceCoordinator coordinator, TempRecordingFiles tempRecordingFiles) {
        return new UploadService(coordinator, tempRecordingFiles);
    }

    /**
     * Background reconciliation. Active unless {@code vault.reconcile-enabled=false}.
     */
    @Bean
    @ConditionalOnProperty(prefix = "vault", name = "reconcile-enabled", havingValue = "true", matchIfMissing = true)
    public VaultReconciler vaultReconciler(PersistenceCoordinator coordinator) {
        return new VaultReconciler(coordinator);
    }
}
