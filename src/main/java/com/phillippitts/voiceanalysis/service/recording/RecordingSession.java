package com.phillippitts.voiceanalysis.service.recording;

import com.phillippitts.voiceanalysis.domain.AnalysisRecord;
import com.phillippitts.voiceanalysis.exception.CaptureDeviceException;
import com.phillippitts.voiceanalysis.service.audio.capture.CaptureDevice;
import com.phillippitts.voiceanalysis.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.voiceanalysis.service.persistence.PersistenceCoordinator;
import com.phillippitts.voiceanalysis.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One time-boxed voice recording, from microphone start to hand-off to the
 * {@link PersistenceCoordinator}.
 *
 * <p><b>Countdown:</b> a periodic task on the {@link TaskScheduler} adds one second of
 * elapsed time per tick while the state is RECORDING. When elapsed time reaches the
 * maximum the device is stopped and the session completes. Every scheduled task carries
 * the generation it was created for; pause, stop and cancel bump the generation, so a
 * tick already queued by the scheduler has no effect afterwards.
 *
 * <p><b>Thread Safety:</b> transitions and ticks are serialized by one {@link ReentrantLock}.
 * Illegal transitions throw {@link IllegalStateException}. Capture-device failures are
 * logged, published as {@link CaptureErrorEvent} and reported through the boolean return
 * value and {@link #lastError()}; they never advance the state.
 */
public final class RecordingSession {

    private static final Logger LOG = LogManager.getLogger(RecordingSession.class);

    private final UUID id;
    private final Path tempFile;
    private final CaptureDevice device;
    private final TaskScheduler scheduler;
    private final Duration tickPeriod;
    private final int maxSeconds;
    private final PersistenceCoordinator coordinator;
    private final TempRecordingFiles tempFiles;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final Lock lock = new ReentrantLock();
    private RecordingState state = RecordingState.IDLE;
    private int elapsedSeconds;
    private long generation;
    private ScheduledFuture<?> ticker;
    private String lastError;
    private AnalysisRecord savedRecord;
    private Instant updatedAt;

    public RecordingSession(UUID id,
                            Path tempFile,
                            CaptureDevice device,
                            TaskScheduler scheduler,
                            Duration tickPeriod,
                            int maxSeconds,
                            PersistenceCoordinator coordinator,
                            TempRecordingFiles tempFiles,
                            ApplicationEventPublisher publisher,
                            Clock clock) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.tempFile = Objects.requireNonNull(tempFile, "tempFile must not be null");
        this.device = Objects.requireNonNull(device, "device must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.tickPeriod = Objects.requireNonNull(tickPeriod, "tickPeriod must not be null");
        if (maxSeconds <= 0) {
            throw new IllegalArgumentException("maxSeconds must be positive");
        }
        this.maxSeconds = maxSeconds;
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.tempFiles = Objects.requireNonNull(tempFiles, "tempFiles must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.updatedAt = clock.instant();
    }

    /**
     * Opens the device on the temp file and starts the countdown from the maximum.
     *
     * @return {@code false} if the device failed to start; the session stays IDLE
     * @throws IllegalStateException unless IDLE
     */
    public boolean start() {
        lock.lock();
        try {
            requireState("start", RecordingState.IDLE);
            if (!invokeDevice("start", () -> device.start(tempFile))) {
                return false;
            }
            elapsedSeconds = 0;
            transition(RecordingState.RECORDING);
            scheduleTicker();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Suspends capture and the countdown, keeping elapsed time.
     *
     * @return {@code false} if the device failed to pause; the session keeps recording
     */
    public boolean pause() {
        lock.lock();
        try {
            requireState("pause", RecordingState.RECORDING);
            if (!invokeDevice("pause", device::pause)) {
                return false;
            }
            cancelTicker();
            transition(RecordingState.PAUSED);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code false} if the device failed to resume; the session stays PAUSED
     */
    public boolean resume() {
        lock.lock();
        try {
            requireState("resume", RecordingState.PAUSED);
            if (!invokeDevice("resume", device::resume)) {
                return false;
            }
            transition(RecordingState.RECORDING);
            scheduleTicker();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Manual completion before the countdown runs out.
     *
     * @return {@code false} if the device reported an error while finishing the file
     */
    public boolean stop() {
        lock.lock();
        try {
            requireState("stop", RecordingState.RECORDING, RecordingState.PAUSED);
            return complete();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the completed take and records again from zero on the same temp file.
     *
     * @return result of the new {@link #start()}
     */
    public boolean restart() {
        lock.lock();
        try {
            requireState("restart", RecordingState.COMPLETED);
            tempFiles.discard(tempFile);
            elapsedSeconds = 0;
            lastError = null;
            transition(RecordingState.IDLE);
            return start();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the device if needed and discards the temp file. Nothing is submitted.
     */
    public void cancel() {
        lock.lock();
        try {
            requireState("cancel", RecordingState.IDLE, RecordingState.RECORDING,
                    RecordingState.PAUSED, RecordingState.COMPLETED);
            cancelTicker();
            if (state.isCapturing()) {
                invokeDevice("stop", device::stop);
            }
            tempFiles.discard(tempFile);
            transition(RecordingState.DISCARDED);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands the completed recording to the coordinator. On success the session is SAVED
     * and the temp file is removed; on failure it stays COMPLETED so the caller can retry.
     *
     * @throws IllegalStateException unless COMPLETED
     * @throws com.phillippitts.voiceanalysis.exception.VoiceAnalysisException whatever the coordinator raised
     */
    public AnalysisRecord save(String title, String description) {
        lock.lock();
        try {
            requireState("save", RecordingState.COMPLETED);
            AnalysisRecord record = coordinator.createAnalysis(title, description, tempFile);
            savedRecord = record;
            transition(RecordingState.SAVED);
            tempFiles.discard(tempFile);
            LOG.info("Recording session {} saved as analysis {}", id, record.id());
            return record;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies one countdown tick if {@code tickGeneration} is current and the session is recording.
     */
    void onTick(long tickGeneration) {
        lock.lock();
        try {
            if (tickGeneration != generation || state != RecordingState.RECORDING) {
                return;
            }
            elapsedSeconds = Math.min(elapsedSeconds + 1, maxSeconds);
            if (elapsedSeconds >= maxSeconds) {
                LOG.info("Recording session {} reached the {}s limit", id, maxSeconds);
                complete();
            }
        } finally {
            lock.unlock();
        }
    }

    public RecordingSnapshot snapshot() {
        lock.lock();
        try {
            int remaining = remainingSeconds();
            return new RecordingSnapshot(id, state, elapsedSeconds, remaining, maxSeconds,
                    TimeUtils.formatMinutesSeconds(remaining),
                    savedRecord == null ? null : savedRecord.id(), lastError, updatedAt);
        } finally {
            lock.unlock();
        }
    }

    public UUID id() {
        return id;
    }

    public Path tempFile() {
        return tempFile;
    }

    public RecordingState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int elapsedSeconds() {
        lock.lock();
        try {
            return elapsedSeconds;
        } finally {
            lock.unlock();
        }
    }

    public int remainingSeconds() {
        lock.lock();
        try {
            return Math.max(0, Math.min(maxSeconds, maxSeconds - elapsedSeconds));
        } finally {
            lock.unlock();
        }
    }

    public String formattedRemaining() {
        return TimeUtils.formatMinutesSeconds(remainingSeconds());
    }

    public Optional<String> lastError() {
        lock.lock();
        try {
            return Optional.ofNullable(lastError);
        } finally {
            lock.unlock();
        }
    }

    public Optional<AnalysisRecord> savedRecord() {
        lock.lock();
        try {
            return Optional.ofNullable(savedRecord);
        } finally {
            lock.unlock();
        }
    }

    /** Time of the last state change. */
    public Instant updatedAt() {
        lock.lock();
        try {
            return updatedAt;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private boolean complete() {
        cancelTicker();
        boolean stopped = invokeDevice("stop", device::stop);
        transition(RecordingState.COMPLETED);
        return stopped;
    }

    private void scheduleTicker() {
        long tickGeneration = ++generation;
        ticker = scheduler.scheduleAtFixedRate(() -> onTick(tickGeneration),
                clock.instant().plus(tickPeriod), tickPeriod);
    }

    private void cancelTicker() {
        generation++;
        if (ticker != null) {
            ticker.cancel(false);
            ticker = null;
        }
    }

    private boolean invokeDevice(String operation, Runnable call) {
        try {
            call.run();
            return true;
        } catch (CaptureDeviceException e) {
            lastError = e.getMessage();
            LOG.warn("Capture device {} failed for session {}: {}", operation, id, e.getMessage());
            publisher.publishEvent(new CaptureErrorEvent(id, operation, e.getReason(), clock.instant()));
            return false;
        }
    }

    private void requireState(String operation, RecordingState... allowed) {
        for (RecordingState candidate : allowed) {
            if (state == candidate) {
                return;
            }
        }
        throw new IllegalStateException("Cannot " + operation + " recording session " + id + " in state " + state);
    }

    private void transition(RecordingState next) {
        RecordingState previous = state;
        state = next;
        updatedAt = clock.instant();
        LOG.debug("Recording session {}: {} -> {}", id, previous, next);
        publisher.publishEvent(new RecordingStateChangedEvent(id, previous, next, updatedAt));
    }
}
