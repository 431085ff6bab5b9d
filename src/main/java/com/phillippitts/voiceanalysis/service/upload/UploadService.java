package com.phillippitts.voiceanalysis.service.upload;

import com.phillippitts.voiceanalysis.domain.AnalysisRecord;
import com.phillippitts.voiceanalysis.exception.FileStorageExceptionBuilder;
import com.phillippitts.voiceanalysis.exception.ValidationException;
import com.phillippitts.voiceanalysis.service.persistence.PersistenceCoordinator;
import com.phillippitts.voiceanalysis.service.recording.TempRecordingFiles;
import com.phillippitts.voiceanalysis.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point for existing audio files. Checks the extension and hands the file to
 * {@link PersistenceCoordinator#createAnalysis}.
 */
public class UploadService {

    private static final Logger LOG = LogManager.getLogger(UploadService.class);

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("mp3", "wav", "m4a");

    private final PersistenceCoordinator coordinator;
    private final TempRecordingFiles tempFiles;

    public UploadService(PersistenceCoordinator coordinator, TempRecordingFiles tempFiles) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.tempFiles = Objects.requireNonNull(tempFiles, "tempFiles must not be null");
    }

    /**
     * Persists a file already on disk. The file itself is left in place.
     */
    public AnalysisRecord upload(Path file, String title, String description) {
        Objects.requireNonNull(file, "file must not be null");
        requireSupportedExtension(LogSanitizer.fileName(file));
        return coordinator.createAnalysis(title, description, file);
    }

    /**
     * Persists uploaded bytes. They are staged in the temp directory, copied into the
     * vault by the coordinator, and the staged copy is removed either way.
     */
    public AnalysisRecord upload(InputStream content, String originalFilename, String title, String description) {
        Objects.requireNonNull(content, "content must not be null");
        String extension = requireSupportedExtension(originalFilename);
        if (title == null || title.isBlank()) {
            throw new ValidationException("title", "must not be blank");
        }
        Path staged = tempFiles.directory().resolve("upload-" + UUID.randomUUID() + "." + extension);
        try {
            Files.createDirectories(staged.getParent());
            Files.copy(content, staged, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            tempFiles.discard(staged);
            throw FileStorageExceptionBuilder.create("Failed to stage upload")
                    .path(staged)
                    .operation("upload")
                    .cause(e)
                    .build();
        }
        try {
            AnalysisRecord record = coordinator.createAnalysis(title, description, staged);
            LOG.info("Uploaded {} as analysis {}", LogSanitizer.truncate(originalFilename, 60), record.id());
            return record;
        } finally {
            tempFiles.discard(staged);
        }
    }

    static String requireSupportedExtension(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new ValidationException("file", "file name is required");
        }
        int dot = filename.lastIndexOf('.');
        String extension = dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new ValidationException("file",
                    "unsupported audio format '" + extension + "'; expected one of mp3, wav, m4a");
        }
        return extension;
    }
}
