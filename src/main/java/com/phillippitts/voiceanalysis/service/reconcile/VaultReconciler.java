package com.phillippitts.voiceanalysis.service.reconcile;

import com.phillippitts.voiceanalysis.service.persistence.PersistenceCoordinator;
import com.phillippitts.voiceanalysis.service.persistence.ReconcileSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.Objects;
import java.util.Optional;

/**
 * Background repair of half-finished creates and deletes.
 *
 * <p>Runs once when the application is ready, which picks up orphaned vault directories and
 * rows left outside the vault before a restart, and then every
 * {@code vault.reconcile-interval-ms}.
 */
public class VaultReconciler {

    private static final Logger LOG = LogManager.getLogger(VaultReconciler.class);

    private final PersistenceCoordinator coordinator;

    public VaultReconciler(PersistenceCoordinator coordinator) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        sweep();
    }

    @Scheduled(fixedDelayString = "${vault.reconcile-interval-ms:300000}",
            initialDelayString = "${vault.reconcile-interval-ms:300000}")
    public void scheduledSweep() {
        sweep();
    }

    /**
     * @return the sweep outcome, or empty if the sweep itself failed
     */
    public Optional<ReconcileSummary> sweep() {
        try {
            ReconcileSummary summary = coordinator.reconcileAll();
            if (summary.unresolved() > 0) {
                LOG.warn("{} analysis id(s) still need reconciliation", summary.unresolved());
            }
            return Optional.of(summary);
        } catch (RuntimeException e) {
            LOG.error("Reconciliation sweep failed", e);
            return Optional.empty();
        }
    }
}
