package com.phillippitts.voiceanalysis.service.vault;

import com.phillippitts.voiceanalysis.config.properties.VaultProperties;
import com.phillippitts.voiceanalysis.exception.FileStorageExceptionBuilder;
import com.phillippitts.voiceanalysis.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Owns the on-disk layout of audio artifacts: {@code <base>/recording_<id>/recording.<ext>}.
 *
 * <p>The base directory is resolved on first use and then stays fixed for the lifetime of
 * the process. The external directory is preferred; when it is unset or cannot be created
 * or written, the private directory is used instead.
 *
 * <p>Thread-safe. Operations on the same id must be serialized by the caller.
 */
public class FileVault {

    private static final Logger LOG = LogManager.getLogger(FileVault.class);

    static final String DIRECTORY_PREFIX = "recording_";
    static final String ARTIFACT_NAME = "recording";
    private static final Pattern DIRECTORY_PATTERN = Pattern.compile("recording_(\\d+)");

    private final VaultProperties properties;
    private volatile Path baseDirectory;

    public FileVault(VaultProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * Copies {@code source} into the id-keyed directory, keeping its extension.
     * The source is never moved. Re-running for the same id overwrites the artifact.
     *
     * @return absolute permanent path of the stored artifact
     * @throws com.phillippitts.voiceanalysis.exception.FileStorageException on any I/O failure
     */
    public Path store(Path source, long id) {
        Objects.requireNonNull(source, "source must not be null");
        Path directory = directoryFor(id);
        Path target = directory.resolve(artifactName(source));
        try {
            Files.createDirectories(directory);
            removeStaleArtifacts(directory, target);
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw FileStorageExceptionBuilder.create("Failed to store recording")
                    .analysisId(id)
                    .path(target)
                    .operation("store")
                    .metadata("source", LogSanitizer.fileName(source))
                    .cause(e)
                    .build();
        }
        LOG.debug("Stored {} for analysis {} at {}", LogSanitizer.fileName(source), id, target);
        return target;
    }

    /**
     * Removes the id-keyed directory and everything inside it.
     *
     * @return {@code false} if the directory did not exist, {@code true} once removed
     * @throws com.phillippitts.voiceanalysis.exception.FileStorageException if an entry cannot be deleted
     */
    public boolean delete(long id) {
        Path directory = directoryFor(id);
        if (!Files.isDirectory(directory)) {
            return false;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            List<Path> entries = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path entry : entries) {
                Files.deleteIfExists(entry);
            }
        } catch (NoSuchFileException e) {
            // Removed concurrently between the check and the walk
            LOG.debug("Vault directory for analysis {} vanished during delete", id);
            return false;
        } catch (IOException e) {
            throw FileStorageExceptionBuilder.create("Failed to delete recording directory")
                    .analysisId(id)
                    .path(directory)
                    .operation("delete")
                    .cause(e)
                    .build();
        }
        LOG.debug("Deleted vault directory for analysis {}", id);
        return true;
    }

    public Path directoryFor(long id) {
        if (id <= 0) {
            throw new IllegalArgumentException("id must be positive: " + id);
        }
        return baseDirectory().resolve(DIRECTORY_PREFIX + id);
    }

    /**
     * Locates the stored artifact for an id without consulting the store.
     *
     * @return the single {@code recording*} file, or empty if the directory holds none
     */
    public Optional<Path> findArtifact(long id) {
        Path directory = directoryFor(id);
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, ARTIFACT_NAME + "*")) {
            for (Path file : files) {
                if (Files.isRegularFile(file)) {
                    return Optional.of(file);
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw FileStorageExceptionBuilder.create("Failed to list recording directory")
                    .analysisId(id)
                    .path(directory)
                    .operation("find")
                    .cause(e)
                    .build();
        }
    }

    /** Ids that currently own a vault directory, in ascending order. */
    public List<Long> listVaultIds() {
        Path base = baseDirectory();
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        List<Long> ids = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(base, Files::isDirectory)) {
            for (Path dir : dirs) {
                Matcher m = DIRECTORY_PATTERN.matcher(dir.getFileName().toString());
                if (m.matches()) {
                    ids.add(Long.parseLong(m.group(1)));
                }
            }
        } catch (IOException e) {
            throw FileStorageExceptionBuilder.create("Failed to list vault")
                    .path(base)
                    .operation("list")
                    .cause(e)
                    .build();
        }
        ids.sort(Comparator.naturalOrder());
        return ids;
    }

    /** Base directory, resolved once on first call. */
    public Path baseDirectory() {
        Path base = baseDirectory;
        if (base == null) {
            synchronized (this) {
                base = baseDirectory;
                if (base == null) {
                    base = resolveBaseDirectory();
                    baseDirectory = base;
                    LOG.info("Audio vault base directory: {}", base);
                }
            }
        }
        return base;
    }

    private Path resolveBaseDirectory() {
        String external = properties.getExternalDir();
        if (external != null && !external.isBlank()) {
            Path candidate = Paths.get(external).toAbsolutePath().resolve(properties.getFolderName());
            if (isUsable(candidate)) {
                return candidate;
            }
            LOG.warn("External vault directory {} is not usable; falling back to private storage", candidate);
        }
        return Paths.get(properties.getPrivateDir()).toAbsolutePath().resolve(properties.getFolderName());
    }

    private static boolean isUsable(Path candidate) {
        try {
            Files.createDirectories(candidate);
            return Files.isWritable(candidate);
        } catch (IOException | SecurityException e) {
            LOG.debug("Cannot create {}: {}", candidate, e.getMessage());
            return false;
        }
    }

    private static void removeStaleArtifacts(Path directory, Path keep) throws IOException {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, ARTIFACT_NAME + "*")) {
            for (Path file : files) {
                if (!file.getFileName().equals(keep.getFileName())) {
                    Files.deleteIfExists(file);
                }
            }
        }
    }

    static String artifactName(Path source) {
        Path fileName = source.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return ARTIFACT_NAME;
        }
        return ARTIFACT_NAME + name.substring(dot);
    }
}
