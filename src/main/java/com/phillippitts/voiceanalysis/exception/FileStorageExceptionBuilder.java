package com.phillippitts.voiceanalysis.exception;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link FileStorageException} with contextual metadata.
 *
 * <pre>
 * throw FileStorageExceptionBuilder.create("Failed to copy recording")
 *         .analysisId(id)
 *         .path(target)
 *         .operation("store")
 *         .cause(e)
 *         .build();
 * </pre>
 */
public final class FileStorageExceptionBuilder {

    private final String message;
    private Long analysisId;
    private Path path;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private FileStorageExceptionBuilder(String message) {
        this.message = message;
    }

    public static FileStorageExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new FileStorageExceptionBuilder(message);
    }

    public FileStorageExceptionBuilder analysisId(long analysisId) {
        this.analysisId = analysisId;
        return this;
    }

    public FileStorageExceptionBuilder path(Path path) {
        this.path = path;
        return this;
    }

    public FileStorageExceptionBuilder operation(String operation) {
        return metadata("operation", operation);
    }

    public FileStorageExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public FileStorageExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (analysisId={id}, path={path}, {key1}={val1}, ...)
     * </pre>
     */
    public FileStorageException build() {
        String pathText = path != null ? path.toString() : null;
        String detailed = buildDetailedMessage(pathText);
        if (cause != null) {
            return new FileStorageException(detailed, analysisId, pathText, cause);
        }
        return new FileStorageException(detailed, analysisId, pathText);
    }

    private String buildDetailedMessage(String pathText) {
        Map<String, String> details = new LinkedHashMap<>();
        if (analysisId != null) {
            details.put("analysisId", String.valueOf(analysisId));
        }
        if (pathText != null) {
            details.put("path", pathText);
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
