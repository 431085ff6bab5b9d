/**
 * Persistence protocol for analyses.
 *
 * <p>{@link com.phillippitts.voiceanalysis.service.persistence.DefaultPersistenceCoordinator}
 * is the only writer of analysis rows and vault directories. Writes for one id are serialized
 * through {@link com.phillippitts.voiceanalysis.service.persistence.IdLockRegistry}; ids left
 * half-written are tracked in
 * {@link com.phillippitts.voiceanalysis.service.persistence.UnresolvedAnalysisRegistry} until
 * {@code reconcile} repairs them.
 */
package com.phillippitts.voiceanalysis.service.persistence;
