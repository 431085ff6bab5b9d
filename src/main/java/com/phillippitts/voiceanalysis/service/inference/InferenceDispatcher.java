package com.phillippitts.voiceanalysis.service.inference;

import com.phillippitts.voiceanalysis.exception.AnalysisNotFoundException;
import com.phillippitts.voiceanalysis.exception.InferenceException;
import com.phillippitts.voiceanalysis.service.persistence.AnalysisCreatedEvent;
import com.phillippitts.voiceanalysis.service.persistence.PersistenceCoordinator;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.event.EventListener;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Sends committed recordings to the {@link InferenceClient} and feeds the results back
 * through {@link PersistenceCoordinator#applyPredictions}.
 *
 * <p>Work runs on the inference executor so the publishing thread is never blocked.
 * After all channels are applied the record is marked SENT. An {@link InferenceException}
 * marks it ERROR with the back end's message; any other failure uses a generic message.
 * Without an {@link InferenceClient} bean records simply stay PENDING.
 */
public class InferenceDispatcher {

    private static final Logger LOG = LogManager.getLogger(InferenceDispatcher.class);

    static final String GENERIC_ERROR = "An internal error occurred during analysis processing.";

    private final PersistenceCoordinator coordinator;
    private final ObjectProvider<InferenceClient> clientProvider;
    private final Executor executor;

    public InferenceDispatcher(PersistenceCoordinator coordinator,
                               ObjectProvider<InferenceClient> clientProvider,
                               Executor executor) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.clientProvider = Objects.requireNonNull(clientProvider, "clientProvider must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @EventListener
    public void onAnalysisCreated(AnalysisCreatedEvent event) {
        InferenceClient client = clientProvider.getIfAvailable();
        if (client == null) {
            LOG.debug("No inference client configured; analysis {} stays pending", event.analysisId());
            return;
        }
        executor.execute(() -> dispatch(client, event));
    }

    void dispatch(InferenceClient client, AnalysisCreatedEvent event) {
        long id = event.analysisId();
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("analysisId", String.valueOf(id))) {
            try {
                List<PredictionResult> results = client.analyze(id, event.audioPath());
                for (PredictionResult result : results) {
                    coordinator.applyPredictions(id, result.channel(), result.probabilities(), result.completedAt());
                }
                coordinator.markSent(id);
                LOG.info("Inference finished for analysis {} ({} channel(s))", id, results.size());
            } catch (AnalysisNotFoundException e) {
                LOG.info("Analysis {} was deleted before inference finished", id);
            } catch (InferenceException e) {
                LOG.warn("Inference failed for analysis {}: {}", id, e.getMessage());
                markError(id, e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Unexpected failure while processing analysis {}", id, e);
                markError(id, GENERIC_ERROR);
            }
        }
    }

    private void markError(long id, String message) {
        try {
            coordinator.markError(id, message);
        } catch (AnalysisNotFoundException e) {
            LOG.info("Analysis {} was deleted before its failure could be recorded", id);
        } catch (RuntimeException e) {
            LOG.error("Could not record inference failure for analysis {}", id, e);
        }
    }
}
