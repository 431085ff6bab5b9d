package com.phillippitts.voiceanalysis.service.recording;

import com.phillippitts.voiceanalysis.config.properties.RecordingProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Allocates and removes temporary recording files under {@code recording.temp-dir}.
 */
public class TempRecordingFiles {

    private static final Logger LOG = LogManager.getLogger(TempRecordingFiles.class);

    private final Path directory;
    private final String extension;

    public TempRecordingFiles(RecordingProperties properties) {
        this(Paths.get(properties.getTempDir()), properties.getFileExtension());
    }

    public TempRecordingFiles(Path directory, String extension) {
        this.directory = directory.toAbsolutePath();
        this.extension = extension;
    }

    /**
     * Path for a session's recording; the directory is created, the file is not.
     */
    public Path pathFor(UUID sessionId) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create temp recording directory " + directory, e);
        }
        return directory.resolve("recording-" + sessionId + "." + extension);
    }

    /**
     * Deletes a temp file. A failure is logged and reported, never thrown.
     *
     * @return {@code true} if the file is gone afterwards
     */
    public boolean discard(Path file) {
        try {
            Files.deleteIfExists(file);
            return true;
        } catch (IOException e) {
            LOG.warn("Could not delete temp recording {}: {}", file.getFileName(), e.getMessage());
            return false;
        }
    }

    public Path directory() {
        return directory;
    }
}
