package com.phillippitts.voiceanalysis.service.recording;

import java.time.Instant;
import java.util.UUID;

/**
 * Point-in-time view of a {@link RecordingSession}.
 *
 * @param sessionId          session id
 * @param state              current state
 * @param elapsedSeconds     seconds recorded so far
 * @param remainingSeconds   countdown value, never negative
 * @param maxSeconds         countdown start
 * @param formattedRemaining countdown as {@code mm:ss}
 * @param savedAnalysisId    id of the saved analysis, {@code null} until SAVED
 * @param lastError          last capture failure reason, {@code null} if none
 * @param updatedAt          time of the last state change
 */
public record RecordingSnapshot(
        UUID sessionId,
        RecordingState state,
        int elapsedSeconds,
        int remainingSeconds,
        int maxSeconds,
        String formattedRemaining,
        Long savedAnalysisId,
        String lastError,
        Instant updatedAt
) {
}
