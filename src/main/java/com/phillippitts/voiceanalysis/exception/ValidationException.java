package com.phillippitts.voiceanalysis.exception;

/**
 * Thrown when caller input is rejected before any write takes place
 * (empty title, missing source file, unsupported extension, feedback on an empty channel).
 */
public class ValidationException extends VoiceAnalysisException {

    private final String field;
    private final String reason;

    public ValidationException(String field, String reason) {
        super("Validation failed for '" + field + "': " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
