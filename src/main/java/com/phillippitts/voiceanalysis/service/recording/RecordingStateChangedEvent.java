package com.phillippitts.voiceanalysis.service.recording;

import java.time.Instant;
import java.util.UUID;

/**
 * Published on every state change of a recording session.
 */
public record RecordingStateChangedEvent(UUID sessionId, RecordingState from, RecordingState to, Instant at) { }
