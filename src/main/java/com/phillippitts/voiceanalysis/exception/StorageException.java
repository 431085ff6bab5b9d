package com.phillippitts.voiceanalysis.exception;

/**
 * Thrown when the structured analysis store fails (insert, update, query or delete).
 */
public class StorageException extends VoiceAnalysisException {

    private final String operation;
    private final Long analysisId;

    public StorageException(String operation, Long analysisId, Throwable cause) {
        super("Storage operation '" + operation + "' failed"
                + (analysisId != null ? " for analysis " + analysisId : ""), cause);
        this.operation = operation;
        this.analysisId = analysisId;
    }

    public StorageException(String message) {
        super(message);
        this.operation = "unknown";
        this.analysisId = null;
    }

    public String getOperation() {
        return operation;
    }

    /** Analysis the failed operation targeted, or {@code null} for table-wide operations. */
    public Long getAnalysisId() {
        return analysisId;
    }
}
