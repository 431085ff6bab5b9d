package com.phillippitts.voiceanalysis.exception;

/**
 * Base exception for all voice-analysis application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class VoiceAnalysisException extends RuntimeException {

    public VoiceAnalysisException(String message) {
        super(message);
    }

    public VoiceAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceAnalysisException(Throwable cause) {
        super(cause);
    }
}
