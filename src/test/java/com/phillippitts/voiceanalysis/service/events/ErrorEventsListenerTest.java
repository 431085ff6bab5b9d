package com.phillippitts.voiceanalysis.service.events;

import com.phillippitts.voiceanalysis.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.voiceanalysis.service.recording.RecordingState;
import com.phillippitts.voiceanalysis.service.recording.RecordingStateChangedEvent;
import com.phillippitts.voiceanalysis.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    private MutableClock clock;
    private ErrorEventsListener listener;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T09:00:00Z"));
        listener = new ErrorEventsListener(clock);
    }

    @Test
    void repeatsAreThrottledPerKey() {
        assertThat(listener.shouldLog("capture-start-MIC_UNAVAILABLE")).isTrue();
        assertThat(listener.shouldLog("capture-start-MIC_UNAVAILABLE")).isFalse();
        assertThat(listener.shouldLog("capture-stop-WRITE_FAILED")).isTrue();
    }

    @Test
    void throttleExpiresAfterAMinute() {
        assertThat(listener.shouldLog("capture-start-MIC_UNAVAILABLE")).isTrue();

        clock.advance(ErrorEventsListener.THROTTLE);
        assertThat(listener.shouldLog("capture-start-MIC_UNAVAILABLE")).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(listener.shouldLog("capture-start-MIC_UNAVAILABLE")).isTrue();
    }

    @Test
    void hintsNameTheSettingToCheck() {
        assertThat(ErrorEventsListener.hintFor("MIC_UNAVAILABLE")).contains("audio.capture.device-name");
        assertThat(ErrorEventsListener.hintFor("WRITE_FAILED")).contains("recording.temp-dir");
        assertThat(ErrorEventsListener.hintFor("CAPTURE_ERROR")).isNotBlank();
    }

    @Test
    void handlersDoNotThrow() {
        UUID id = UUID.randomUUID();

        assertThatCode(() -> {
            listener.onCaptureError(new CaptureErrorEvent(id, "start", "MIC_PERMISSION_DENIED", clock.instant()));
            listener.onCaptureError(new CaptureErrorEvent(id, "start", "MIC_PERMISSION_DENIED", clock.instant()));
            listener.onRecordingDiscarded(new RecordingStateChangedEvent(id, RecordingState.COMPLETED,
                    RecordingState.DISCARDED, clock.instant()));
            listener.onRecordingDiscarded(new RecordingStateChangedEvent(id, RecordingState.IDLE,
                    RecordingState.RECORDING, clock.instant()));
        }).doesNotThrowAnyException();
    }
}
