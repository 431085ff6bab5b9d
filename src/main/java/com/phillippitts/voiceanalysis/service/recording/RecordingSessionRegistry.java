package com.phillippitts.voiceanalysis.service.recording;

import com.phillippitts.voiceanalysis.exception.RecordingSessionNotFoundException;
import com.phillippitts.voiceanalysis.service.audio.capture.CaptureDeviceFactory;
import com.phillippitts.voiceanalysis.service.persistence.PersistenceCoordinator;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates {@link RecordingSession}s and keeps them addressable by id.
 *
 * <p>Sessions in a terminal state are purged after {@link #RETENTION}.
 */
public class RecordingSessionRegistry {

    private static final Logger LOG = LogManager.getLogger(RecordingSessionRegistry.class);

    static final Duration RETENTION = Duration.ofMinutes(10);

    private final CaptureDeviceFactory deviceFactory;
    private final TempRecordingFiles tempFiles;
    private final TaskScheduler scheduler;
    private final PersistenceCoordinator coordinator;
    private final ApplicationEventPublisher publisher;
    private final Duration tickPeriod;
    private final int maxSeconds;
    private final Clock clock;

    private final Map<UUID, RecordingSession> sessions = new ConcurrentHashMap<>();

    public RecordingSessionRegistry(CaptureDeviceFactory deviceFactory,
                                    TempRecordingFiles tempFiles,
                                    TaskScheduler scheduler,
                                    PersistenceCoordinator coordinator,
                                    ApplicationEventPublisher publisher,
                                    Duration tickPeriod,
                                    int maxSeconds,
                                    Clock clock) {
        this.deviceFactory = Objects.requireNonNull(deviceFactory, "deviceFactory must not be null");
        this.tempFiles = Objects.requireNonNull(tempFiles, "tempFiles must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.tickPeriod = Objects.requireNonNull(tickPeriod, "tickPeriod must not be null");
        this.maxSeconds = maxSeconds;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creates an IDLE session with a fresh temp file and its own capture device.
     */
    public RecordingSession create() {
        UUID id = UUID.randomUUID();
        Path tempFile = tempFiles.pathFor(id);
        RecordingSession session = new RecordingSession(id, tempFile, deviceFactory.create(id), scheduler,
                tickPeriod, maxSeconds, coordinator, tempFiles, publisher, clock);
        sessions.put(id, session);
        LOG.info("Created recording session {}", id);
        return session;
    }

    /** Creates a session and starts it; a failed start leaves it IDLE with {@code lastError} set. */
    public RecordingSession createAndStart() {
        RecordingSession session = create();
        session.start();
        return session;
    }

    public Optional<RecordingSession> find(UUID id) {
        return Optional.ofNullable(sessions.get(id));
    }

    /**
     * @throws RecordingSessionNotFoundException for an unknown or purged id
     */
    public RecordingSession require(UUID id) {
        RecordingSession session = sessions.get(id);
        if (session == null) {
            throw new RecordingSessionNotFoundException(id);
        }
        return session;
    }

    public Collection<RecordingSession> all() {
        return List.copyOf(sessions.values());
    }

    /**
     * Drops terminal sessions whose last change is older than {@link #RETENTION}.
     *
     * @return number of sessions removed
     */
    @Scheduled(fixedDelayString = "${recording.purge-interval-ms:60000}")
    public int purgeFinished() {
        Instant cutoff = clock.instant().minus(RETENTION);
        int removed = 0;
        for (RecordingSession session : all()) {
            if (session.state().isTerminal() && session.updatedAt().isBefore(cutoff)) {
                sessions.remove(session.id());
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("Purged {} finished recording session(s)", removed);
        }
        return removed;
    }

    /** Cancels sessions that are still open so no device or temp file outlives the context. */
    @PreDestroy
    public void shutdown() {
        for (RecordingSession session : all()) {
            if (!session.state().isTerminal()) {
                LOG.info("Shutting down with open recording session {}; cancelling", session.id());
                session.cancel();
            }
        }
    }
}
