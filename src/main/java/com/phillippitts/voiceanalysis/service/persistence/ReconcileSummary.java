package com.phillippitts.voiceanalysis.service.persistence;

/**
 * Outcome of one reconciliation sweep.
 *
 * @param examined   ids looked at (flagged ids plus vault directories without a row)
 * @param repaired   ids brought back to a consistent state
 * @param unresolved ids still flagged after the sweep
 */
public record ReconcileSummary(int examined, int repaired, int unresolved) {
}
