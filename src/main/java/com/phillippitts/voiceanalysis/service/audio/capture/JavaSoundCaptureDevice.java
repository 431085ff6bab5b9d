package com.phillippitts.voiceanalysis.service.audio.capture;

import com.phillippitts.voiceanalysis.config.properties.AudioCaptureProperties;
import com.phillippitts.voiceanalysis.exception.CaptureDeviceException;
import com.phillippitts.voiceanalysis.service.audio.AudioFormat;
import com.phillippitts.voiceanalysis.service.audio.WavWriter;
import com.phillippitts.voiceanalysis.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Java Sound based microphone capture that streams PCM16LE mono @16kHz into a WAV file.
 *
 * <p>A background thread reads the line in chunks of {@code audio.capture.chunk-millis}.
 * While paused the line keeps running and chunks are discarded, so resume is immediate.
 * Errors on the capture thread are logged and published as {@link CaptureErrorEvent};
 * the next {@link #stop()} reports them to the owner.
 */
public class JavaSoundCaptureDevice implements CaptureDevice {

    private static final Logger LOG = LogManager.getLogger(JavaSoundCaptureDevice.class);

    static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final UUID sessionId;
    private final DataLineProvider provider;

    private final Object lock = new Object();
    private final AtomicBoolean active = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private volatile Thread thread;
    private volatile String failure;

    public JavaSoundCaptureDevice(AudioCaptureProperties props,
                                  ApplicationEventPublisher publisher,
                                  UUID sessionId) {
        this(props, publisher, sessionId, defaultProvider());
    }

    // Package-private for tests
    JavaSoundCaptureDevice(AudioCaptureProperties props,
                           ApplicationEventPublisher publisher,
                           UUID sessionId,
                           DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.sessionId = Objects.requireNonNull(sessionId);
        this.provider = Objects.requireNonNull(provider);
    }

    static DataLineProvider defaultProvider() {
        return (format, device) -> {
            Mixer.Info[] mixers = AudioSystem.getMixerInfo();
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : mixers) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public void start(Path target) {
        Objects.requireNonNull(target, "target must not be null");
        synchronized (lock) {
            if (thread != null) {
                throw new IllegalStateException("Capture already running for session " + sessionId);
            }
            TargetDataLine line = openLine();
            WavWriter writer;
            try {
                writer = WavWriter.open(target);
            } catch (IOException e) {
                closeLine(line);
                LOG.warn("Cannot open {} for capture: {}", LogSanitizer.fileName(target), e.getMessage());
                throw new CaptureDeviceException("start", "FILE_UNAVAILABLE", e);
            }
            failure = null;
            paused.set(false);
            active.set(true);
            line.start();
            int bytesPerChunk = props.chunkBytes();
            Thread t = new Thread(() -> doCapture(line, writer, bytesPerChunk), "audio-capture-" + sessionId);
            t.setDaemon(true);
            thread = t;
            t.start();
            LOG.info("Audio capture started for session {} -> {}", sessionId, LogSanitizer.fileName(target));
        }
    }

    private TargetDataLine openLine() {
        try {
            return provider.open(AudioFormat.toJavaSound(), props.deviceName());
        } catch (LineUnavailableException e) {
            LOG.warn("Microphone unavailable: {}", e.getMessage());
            throw new CaptureDeviceException("start", "MIC_UNAVAILABLE", e);
        } catch (SecurityException se) {
            LOG.warn("Microphone access denied: {}", se.getMessage());
            throw new CaptureDeviceException("start", "MIC_PERMISSION_DENIED", se);
        } catch (RuntimeException e) {
            throw new CaptureDeviceException("start", "CAPTURE_ERROR", e);
        }
    }

    @Override
    public void pause() {
        requireActive("pause");
        paused.set(true);
        LOG.debug("Audio capture paused for session {}", sessionId);
    }

    @Override
    public void resume() {
        requireActive("resume");
        paused.set(false);
        LOG.debug("Audio capture resumed for session {}", sessionId);
    }

    @Override
    public void stop() {
        Thread captureThread;
        synchronized (lock) {
            captureThread = thread;
            if (captureThread == null) {
                return;
            }
            active.set(false);
            thread = null;
        }
        // Join outside the lock; the capture thread finishes the WAV file before exiting
        joinThread(captureThread, CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
        String error = failure;
        if (error != null) {
            throw new CaptureDeviceException("stop", error);
        }
    }

    private void requireActive(String operation) {
        if (!active.get()) {
            throw new CaptureDeviceException(operation, "Capture is not running");
        }
        if (failure != null) {
            throw new CaptureDeviceException(operation, failure);
        }
    }

    private void doCapture(TargetDataLine line, WavWriter writer, int bytesPerChunk) {
        byte[] buf = new byte[bytesPerChunk];
        try {
            while (active.get()) {
                int n = line.read(buf, 0, buf.length);
                if (n <= 0 || paused.get()) {
                    continue;
                }
                writer.append(buf, 0, n);
            }
        } catch (IOException e) {
            fail("WRITE_FAILED", e);
        } catch (Throwable t) {
            fail("CAPTURE_ERROR", t);
        } finally {
            closeLine(line);
            try {
                writer.close();
                LOG.info("Audio capture completed for session {}: {} bytes (~{}s)",
                        sessionId, writer.dataBytes(), AudioFormat.secondsOf(writer.dataBytes()));
            } catch (IOException e) {
                fail("WRITE_FAILED", e);
            }
        }
    }

    private void fail(String reason, Throwable t) {
        LOG.warn("Capture failed for session {}: {}", sessionId, t.toString());
        failure = reason;
        active.set(false);
        publisher.publishEvent(new CaptureErrorEvent(sessionId, "capture", reason, Instant.now()));
    }

    private static void closeLine(TargetDataLine line) {
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing data line: {}", e.toString());
        }
    }

    private void joinThread(Thread t, long timeoutMs) {
        if (t == null || !t.isAlive()) {
            return;
        }
        try {
            t.join(timeoutMs);
            if (t.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }
}
