package com.phillippitts.voiceanalysis.exception;

import java.util.UUID;

/**
 * Thrown when a recording session id is unknown or has been purged.
 */
public class RecordingSessionNotFoundException extends VoiceAnalysisException {

    private final UUID sessionId;

    public RecordingSessionNotFoundException(UUID sessionId) {
        super("Recording session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }
}
