package com.phillippitts.voiceanalysis.service.audio.capture;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when microphone capture fails (permissions, device errors, write failures).
 *
 * Payload contains the session, the failed operation, a short reason and a timestamp. Avoids any PII.
 */
public record CaptureErrorEvent(UUID sessionId, String operation, String reason, Instant at) { }
