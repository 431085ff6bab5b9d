package com.phillippitts.voiceanalysis.exception;

/**
 * Thrown by a capture device when it cannot start, pause, resume or finalize a recording.
 * Recording sessions treat this as recoverable.
 */
public class CaptureDeviceException extends VoiceAnalysisException {

    private final String operation;
    private final String reason;

    public CaptureDeviceException(String operation, String reason) {
        super("Capture device " + operation + " failed: " + reason);
        this.operation = operation;
        this.reason = reason;
    }

    public CaptureDeviceException(String operation, String reason, Throwable cause) {
        super("Capture device " + operation + " failed: " + reason, cause);
        this.operation = operation;
        this.reason = reason;
    }

    public String getOperation() {
        return operation;
    }

    /** Short, PII-free reason such as {@code MIC_UNAVAILABLE}. */
    public String getReason() {
        return reason;
    }
}
