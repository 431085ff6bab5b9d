package com.phillippitts.voiceanalysis.service.audio;

/**
 * Format of microphone recordings: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    public static final int SAMPLE_RATE = 16_000;
    public static final int BITS_PER_SAMPLE = 16;
    public static final int CHANNELS = 1;
    public static final boolean SIGNED = true;
    /** false = little-endian. */
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS;  // 2 bytes
    /** Bytes per second. */
    public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;          // 32,000

    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /** The same format as a Java Sound descriptor, for opening a TargetDataLine. */
    public static javax.sound.sampled.AudioFormat toJavaSound() {
        return new javax.sound.sampled.AudioFormat(SAMPLE_RATE, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
    }

    /** Whole seconds of audio contained in {@code bytes} of PCM payload. */
    public static long secondsOf(long bytes) {
        return bytes / BYTE_RATE;
    }
}
