package com.phillippitts.voiceanalysis.service.events;

import com.phillippitts.voiceanalysis.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.voiceanalysis.service.recording.RecordingState;
import com.phillippitts.voiceanalysis.service.recording.RecordingStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Logs capture failures and discarded takes. Repeats of the same failure are throttled
 * to one line per minute; events carry no user content.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLogged = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        if (shouldLog("capture-" + e.operation() + '-' + e.reason())) {
            LOG.warn("Capture {} failed for session {}: {}. {}",
                    e.operation(), e.sessionId(), e.reason(), hintFor(e.reason()));
        }
    }

    @EventListener
    void onRecordingDiscarded(RecordingStateChangedEvent e) {
        if (e.to() == RecordingState.DISCARDED && e.from() == RecordingState.COMPLETED) {
            LOG.info("Completed recording {} was discarded without saving", e.sessionId());
        }
    }

    static String hintFor(String reason) {
        return switch (reason) {
            case "MIC_PERMISSION_DENIED" -> "Grant microphone access to the JVM and retry.";
            case "MIC_UNAVAILABLE" -> "Check that an input device is connected and audio.capture.device-name matches it.";
            case "FILE_UNAVAILABLE", "WRITE_FAILED" -> "Check free space and permissions of recording.temp-dir.";
            default -> "See the preceding log lines for the cause.";
        };
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        AtomicBoolean allowed = new AtomicBoolean(false);
        lastLogged.compute(key, (k, prev) -> {
            if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
                allowed.set(true);
                return now;
            }
            return prev;
        });
        return allowed.get();
    }
}
