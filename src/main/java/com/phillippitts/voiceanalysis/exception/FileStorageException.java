package com.phillippitts.voiceanalysis.exception;

/**
 * Thrown when a file vault operation (copy, directory creation, delete) fails.
 *
 * <p>Use {@link FileStorageExceptionBuilder} to attach the analysis id, path and
 * operation in a consistent message format.
 */
public class FileStorageException extends VoiceAnalysisException {

    private final Long analysisId;
    private final String path;

    public FileStorageException(String message) {
        super(message);
        this.analysisId = null;
        this.path = null;
    }

    public FileStorageException(String message, Long analysisId, String path) {
        super(message);
        this.analysisId = analysisId;
        this.path = path;
    }

    public FileStorageException(String message, Long analysisId, String path, Throwable cause) {
        super(message, cause);
        this.analysisId = analysisId;
        this.path = path;
    }

    public Long getAnalysisId() {
        return analysisId;
    }

    public String getPath() {
        return path;
    }
}
