package com.phillippitts.voiceanalysis.service.recording;

/**
 * Lifecycle of a {@link RecordingSession}.
 *
 * <pre>
 * IDLE --start--> RECORDING --pause--> PAUSED --resume--> RECORDING
 * RECORDING|PAUSED --stop or time expired--> COMPLETED
 * COMPLETED --restart--> RECORDING
 * COMPLETED --save--> SAVED
 * IDLE|RECORDING|PAUSED|COMPLETED --cancel--> DISCARDED
 * </pre>
 */
public enum RecordingState {
    IDLE,
    RECORDING,
    PAUSED,
    COMPLETED,
    DISCARDED,
    SAVED;

    public boolean isTerminal() {
        return this == DISCARDED || this == SAVED;
    }

    /** Capture device is open. */
    public boolean isCapturing() {
        return this == RECORDING || this == PAUSED;
    }
}
