package com.phillippitts.voiceanalysis.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for recording sessions.
 */
@Validated
@ConfigurationProperties(prefix = "recording")
public class RecordingProperties {

    /** Maximum recording length; the countdown starts here. */
    @Min(1)
    @Max(600)
    private final int maxDurationSeconds;

    /** Countdown tick period in milliseconds. One tick counts as one elapsed second. */
    @Min(10)
    @Max(10_000)
    private final long tickMillis;

    /** Directory for in-progress recordings; defaults to the JVM temp directory when blank. */
    private final String tempDir;

    /** Extension of files produced by the capture device. */
    @NotBlank
    private final String fileExtension;

    @ConstructorBinding
    public RecordingProperties(@DefaultValue("30") int maxDurationSeconds,
                               @DefaultValue("1000") long tickMillis,
                               String tempDir,
                               @DefaultValue("wav") String fileExtension) {
        this.maxDurationSeconds = maxDurationSeconds;
        this.tickMillis = tickMillis;
        this.tempDir = (tempDir == null || tempDir.isBlank()) ? System.getProperty("java.io.tmpdir") : tempDir;
        this.fileExtension = fileExtension;
    }

    public int getMaxDurationSeconds() { return maxDurationSeconds; }
    public long getTickMillis() { return tickMillis; }
    public Duration getTickPeriod() { return Duration.ofMillis(tickMillis); }
    public String getTempDir() { return tempDir; }
    public String getFileExtension() { return fileExtension; }
}
