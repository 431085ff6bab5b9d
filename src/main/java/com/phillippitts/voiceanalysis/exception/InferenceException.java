package com.phillippitts.voiceanalysis.exception;

/**
 * Thrown by an inference client when predictions cannot be produced.
 * The message is stored on the analysis as its user-visible error message.
 */
public class InferenceException extends VoiceAnalysisException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
