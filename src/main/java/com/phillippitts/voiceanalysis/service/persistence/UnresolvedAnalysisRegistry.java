package com.phillippitts.voiceanalysis.service.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory record of ids whose create or delete protocol stopped half way.
 *
 * <p>Kinds tracked:
 * <ul>
 *   <li>{@link Kind#UNCOMMITTED}: audio relocated, permanent path never reached the store</li>
 *   <li>{@link Kind#ROLLBACK_PENDING}: relocation failed and the compensating delete did too</li>
 *   <li>{@link Kind#ORPHANED}: row deleted, vault directory left behind</li>
 * </ul>
 * The reconciler drains all of them. Nothing here survives a restart; after one, a full
 * sweep finds the same ids from the store and the vault layout (rows whose path is outside
 * their vault directory, directories without a row).
 */
public class UnresolvedAnalysisRegistry {

    public enum Kind { UNCOMMITTED, ROLLBACK_PENDING, ORPHANED }

    /**
     * @param analysisId    affected id
     * @param kind          what is left to repair
     * @param permanentPath relocated artifact, when known
     * @param reason        short failure description
     * @param flaggedAt     when the problem was recorded
     */
    public record Entry(long analysisId, Kind kind, String permanentPath, String reason, Instant flaggedAt) {
    }

    private final Map<Long, Entry> entries = new ConcurrentHashMap<>();

    public void flagUncommitted(long id, String permanentPath, String reason) {
        entries.put(id, new Entry(id, Kind.UNCOMMITTED, permanentPath, reason, Instant.now()));
    }

    public void flagRollbackPending(long id, String reason) {
        entries.put(id, new Entry(id, Kind.ROLLBACK_PENDING, null, reason, Instant.now()));
    }

    public void flagOrphaned(long id, String reason) {
        entries.put(id, new Entry(id, Kind.ORPHANED, null, reason, Instant.now()));
    }

    public Optional<Entry> get(long id) {
        return Optional.ofNullable(entries.get(id));
    }

    public boolean isFlagged(long id) {
        return entries.containsKey(id);
    }

    public void resolve(long id) {
        entries.remove(id);
    }

    public List<Entry> snapshot() {
        return List.copyOf(entries.values());
    }

    public int size() {
        return entries.size();
    }
}
