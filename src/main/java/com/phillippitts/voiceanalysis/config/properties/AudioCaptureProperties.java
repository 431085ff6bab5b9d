package com.phillippitts.voiceanalysis.config.properties;

import com.phillippitts.voiceanalysis.service.audio.AudioFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.Optional;

/**
 * Microphone settings ({@code audio.capture.*}). The sample format itself is fixed by
 * {@link AudioFormat}.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Milliseconds of audio per read from the line. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** Mixer name to match; blank selects the system default input. */
    private final String deviceName;

    @ConstructorBinding
    public AudioCaptureProperties(@DefaultValue("40") int chunkMillis, String deviceName) {
        this.chunkMillis = chunkMillis;
        this.deviceName = deviceName == null ? "" : deviceName.trim();
    }

    public int getChunkMillis() {
        return chunkMillis;
    }

    /** Read buffer size in bytes, always a whole number of frames. */
    public int chunkBytes() {
        int bytes = (chunkMillis * AudioFormat.BYTE_RATE) / 1000;
        return bytes - (bytes % AudioFormat.BLOCK_ALIGN);
    }

    public Optional<String> deviceName() {
        return deviceName.isEmpty() ? Optional.empty() : Optional.of(deviceName);
    }
}
