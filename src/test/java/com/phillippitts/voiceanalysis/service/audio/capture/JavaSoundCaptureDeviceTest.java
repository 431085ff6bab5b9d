package com.phillippitts.voiceanalysis.service.audio.capture;

import com.phillippitts.voiceanalysis.config.properties.AudioCaptureProperties;
import com.phillippitts.voiceanalysis.exception.CaptureDeviceException;
import com.phillippitts.voiceanalysis.service.audio.AudioFormat;
import com.phillippitts.voiceanalysis.service.audio.WavWriter;
import com.phillippitts.voiceanalysis.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sound.sampled.Control;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.Line;
import javax.sound.sampled.LineListener;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class JavaSoundCaptureDeviceTest {

    @TempDir
    Path tempDir;

    private AudioCaptureProperties props;
    private EventCapturingPublisher publisher;
    private UUID sessionId;

    @BeforeEach
    void setUp() {
        props = new AudioCaptureProperties(20, null);
        publisher = new EventCapturingPublisher();
        sessionId = UUID.randomUUID();
    }

    @Test
    void startStopShouldProduceWavWithAlignedPayload() throws Exception {
        RepeatingTargetDataLine line = new RepeatingTargetDataLine(AudioFormat.toJavaSound(), -1);
        JavaSoundCaptureDevice device = device((fmt, dev) -> line);
        Path target = tempDir.resolve("take.wav");

        device.start(target);
        await().atMost(Duration.ofSeconds(2)).until(() -> line.reads() >= 5);
        device.stop();

        long payload = WavWriter.payloadSize(target);
        assertThat(payload).isPositive();
        assertThat(payload % AudioFormat.BLOCK_ALIGN).isZero();
        assertThat(Files.size(target)).isEqualTo(AudioFormat.WAV_HEADER_SIZE + payload);
        assertThat(line.isOpen()).isFalse();
        assertThat(publisher.eventsOf(CaptureErrorEvent.class)).isEmpty();
    }

    @Test
    void pausedChunksShouldBeDiscarded() throws Exception {
        RepeatingTargetDataLine line = new RepeatingTargetDataLine(AudioFormat.toJavaSound(), -1);
        JavaSoundCaptureDevice device = device((fmt, dev) -> line);
        Path target = tempDir.resolve("paused.wav");

        device.start(target);
        device.pause();
        int readsAtPause = line.reads();
        await().atMost(Duration.ofSeconds(2)).until(() -> line.reads() >= readsAtPause + 5);
        device.stop();

        // At most the chunk that was in flight when pause was requested
        assertThat(WavWriter.payloadSize(target)).isLessThanOrEqualTo(RepeatingTargetDataLine.CHUNK_BYTES);
    }

    @Test
    void resumeShouldContinueWritingIntoSameFile() throws Exception {
        RepeatingTargetDataLine line = new RepeatingTargetDataLine(AudioFormat.toJavaSound(), -1);
        JavaSoundCaptureDevice device = device((fmt, dev) -> line);
        Path target = tempDir.resolve("resumed.wav");

        device.start(target);
        device.pause();
        device.resume();
        int readsAtResume = line.reads();
        await().atMost(Duration.ofSeconds(2)).until(() -> line.reads() >= readsAtResume + 5);
        device.stop();

        assertThat(WavWriter.payloadSize(target)).isGreaterThanOrEqualTo(3L * RepeatingTargetDataLine.CHUNK_BYTES);
    }

    @Test
    void secondStartWhileRunningShouldThrow() {
        JavaSoundCaptureDevice device = device((fmt, dev) -> new RepeatingTargetDataLine(fmt, -1));
        device.start(tempDir.resolve("a.wav"));
        try {
            assertThatThrownBy(() -> device.start(tempDir.resolve("b.wav")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already running");
        } finally {
            device.stop();
        }
    }

    @Test
    void permissionDeniedShouldFailStart() {
        JavaSoundCaptureDevice device = device((fmt, dev) -> {
            throw new SecurityException("Microphone access denied");
        });

        assertThatThrownBy(() -> device.start(tempDir.resolve("a.wav")))
                .isInstanceOf(CaptureDeviceException.class)
                .satisfies(e -> assertThat(((CaptureDeviceException) e).getReason()).isEqualTo("MIC_PERMISSION_DENIED"));
        device.stop(); // no-op when never started
    }

    @Test
    void unavailableLineShouldFailStart() {
        JavaSoundCaptureDevice device = device((fmt, dev) -> {
            throw new LineUnavailableException("No audio device available");
        });

        assertThatThrownBy(() -> device.start(tempDir.resolve("a.wav")))
                .isInstanceOf(CaptureDeviceException.class)
                .satisfies(e -> assertThat(((CaptureDeviceException) e).getReason()).isEqualTo("MIC_UNAVAILABLE"));
    }

    @Test
    void unwritableTargetShouldFailStartAndReleaseLine() {
        RepeatingTargetDataLine line = new RepeatingTargetDataLine(AudioFormat.toJavaSound(), -1);
        JavaSoundCaptureDevice device = device((fmt, dev) -> line);

        assertThatThrownBy(() -> device.start(tempDir.resolve("missing-dir").resolve("a.wav")))
                .isInstanceOf(CaptureDeviceException.class)
                .satisfies(e -> assertThat(((CaptureDeviceException) e).getReason()).isEqualTo("FILE_UNAVAILABLE"));
        assertThat(line.isOpen()).isFalse();
    }

    @Test
    void pauseWithoutStartShouldThrow() {
        JavaSoundCaptureDevice device = device((fmt, dev) -> new RepeatingTargetDataLine(fmt, -1));

        assertThatThrownBy(device::pause).isInstanceOf(CaptureDeviceException.class);
        assertThatThrownBy(device::resume).isInstanceOf(CaptureDeviceException.class);
    }

    @Test
    void captureThreadFailureShouldPublishEventAndSurfaceOnStop() throws Exception {
        RepeatingTargetDataLine line = new RepeatingTargetDataLine(AudioFormat.toJavaSound(), 3);
        JavaSoundCaptureDevice device = device((fmt, dev) -> line);
        Path target = tempDir.resolve("broken.wav");

        device.start(target);
        await().atMost(Duration.ofSeconds(2))
                .until(() -> !publisher.eventsOf(CaptureErrorEvent.class).isEmpty());

        CaptureErrorEvent event = publisher.eventsOf(CaptureErrorEvent.class).get(0);
        assertThat(event.sessionId()).isEqualTo(sessionId);
        assertThat(event.reason()).isEqualTo("CAPTURE_ERROR");
        assertThatThrownBy(device::stop)
                .isInstanceOf(CaptureDeviceException.class)
                .satisfies(e -> assertThat(((CaptureDeviceException) e).getReason()).isEqualTo("CAPTURE_ERROR"));
        // The partial take is still a well-formed file
        assertThat(Files.size(target)).isEqualTo(AudioFormat.WAV_HEADER_SIZE + WavWriter.payloadSize(target));
    }

    private JavaSoundCaptureDevice device(JavaSoundCaptureDevice.DataLineProvider provider) {
        return new JavaSoundCaptureDevice(props, publisher, sessionId, provider);
    }

    /**
     * Data line that returns a fixed byte pattern at roughly real-time pace and can be made
     * to fail after a number of reads.
     */
    static final class RepeatingTargetDataLine implements TargetDataLine {
        static final int CHUNK_BYTES = 320; // ~10ms at 16k mono 16-bit

        private final javax.sound.sampled.AudioFormat fmt;
        private final int failAfterReads;
        private final AtomicInteger reads = new AtomicInteger();
        private volatile boolean started;
        private volatile boolean open = true;

        RepeatingTargetDataLine(javax.sound.sampled.AudioFormat fmt, int failAfterReads) {
            this.fmt = fmt;
            this.failAfterReads = failAfterReads;
        }

        int reads() {
            return reads.get();
        }

        @Override public int read(byte[] b, int off, int len) {
            if (!started || !open) {
                return 0;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return 0;
            }
            if (failAfterReads >= 0 && reads.get() >= failAfterReads) {
                throw new IllegalStateException("device unplugged");
            }
            int n = Math.min(len, CHUNK_BYTES);
            for (int i = 0; i < n; i++) {
                b[off + i] = (byte) (i & 0xFF);
            }
            reads.incrementAndGet();
            return n;
        }

        @Override public javax.sound.sampled.AudioFormat getFormat() { return fmt; }
        @Override public void open(javax.sound.sampled.AudioFormat format, int bufferSize) { open = true; }
        @Override public void open(javax.sound.sampled.AudioFormat format) { open = true; }
        @Override public void open() { open = true; }
        @Override public void start() { started = true; }
        @Override public void stop() { started = false; }
        @Override public void close() { open = false; }
        @Override public boolean isOpen() { return open; }
        @Override public boolean isActive() { return started; }
        @Override public boolean isRunning() { return started; }
        @Override public int available() { return 0; }
        @Override public void drain() { }
        @Override public void flush() { }
        @Override public int getBufferSize() { return 0; }
        @Override public int getFramePosition() { return 0; }
        @Override public long getLongFramePosition() { return 0; }
        @Override public long getMicrosecondPosition() { return 0; }
        @Override public float getLevel() { return 0; }
        @Override public Control getControl(Control.Type control) { throw new IllegalArgumentException(); }
        @Override public Control[] getControls() { return new Control[0]; }
        @Override public boolean isControlSupported(Control.Type control) { return false; }
        @Override public void addLineListener(LineListener listener) { }
        @Override public void removeLineListener(LineListener listener) { }
        @Override public Line.Info getLineInfo() { return new DataLine.Info(TargetDataLine.class, fmt); }
    }
}
