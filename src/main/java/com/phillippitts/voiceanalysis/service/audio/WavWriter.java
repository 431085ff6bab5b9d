package com.phillippitts.voiceanalysis.service.audio;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

import static com.phillippitts.voiceanalysis.service.audio.AudioFormat.BITS_PER_SAMPLE;
import static com.phillippitts.voiceanalysis.service.audio.AudioFormat.BLOCK_ALIGN;
import static com.phillippitts.voiceanalysis.service.audio.AudioFormat.BYTE_RATE;
import static com.phillippitts.voiceanalysis.service.audio.AudioFormat.CHANNELS;
import static com.phillippitts.voiceanalysis.service.audio.AudioFormat.SAMPLE_RATE;
import static com.phillippitts.voiceanalysis.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Streams PCM into a WAV file in the fixed recording format.
 *
 * <p>The header is written up front with zero sizes and patched by {@link #close()}, so
 * a recording can be appended chunk by chunk without holding it in memory.
 */
public final class WavWriter implements AutoCloseable {

    private final Path path;
    private final OutputStream out;
    private long dataBytes;
    private boolean closed;

    private WavWriter(Path path, OutputStream out) {
        this.path = path;
        this.out = out;
    }

    /**
     * Creates or truncates {@code path} and writes a placeholder header.
     */
    public static WavWriter open(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        OutputStream os = new BufferedOutputStream(Files.newOutputStream(path,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
        WavWriter writer = new WavWriter(path, os);
        writer.writeHeader(0);
        return writer;
    }

    /**
     * Writes a complete WAV file containing {@code pcm}.
     */
    public static void write(byte[] pcm, Path path) throws IOException {
        Objects.requireNonNull(pcm, "pcm must not be null");
        try (WavWriter writer = open(path)) {
            writer.append(pcm, 0, pcm.length);
        }
    }

    public void append(byte[] pcm, int offset, int length) throws IOException {
        if (closed) {
            throw new IllegalStateException("WAV writer already closed: " + path.getFileName());
        }
        out.write(pcm, offset, length);
        dataBytes += length;
    }

    public long dataBytes() {
        return dataBytes;
    }

    /** Flushes the payload and patches the RIFF and data chunk sizes. */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        out.close();
        try (RandomAccessFile raf = new RandomAccessFile(path.toFile(), "rw")) {
            raf.seek(4);
            raf.write(leInt((int) (36 + dataBytes)));
            raf.seek(40);
            raf.write(leInt((int) dataBytes));
        }
    }

    /** Number of PCM payload bytes in an existing WAV file written by this class. */
    public static long payloadSize(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            byte[] header = in.readNBytes(WAV_HEADER_SIZE);
            if (header.length < WAV_HEADER_SIZE) {
                return 0;
            }
            return (header[40] & 0xFFL) | (header[41] & 0xFFL) << 8
                    | (header[42] & 0xFFL) << 16 | (header[43] & 0xFFL) << 24;
        }
    }

    private void writeHeader(int dataSize) throws IOException {
        out.write(new byte[] {'R', 'I', 'F', 'F'});
        out.write(leInt(36 + dataSize));
        out.write(new byte[] {'W', 'A', 'V', 'E'});
        out.write(new byte[] {'f', 'm', 't', ' '});
        out.write(leInt(16));                     // PCM subchunk size
        out.write(leShort(1));                    // PCM
        out.write(leShort(CHANNELS));
        out.write(leInt(SAMPLE_RATE));
        out.write(leInt(BYTE_RATE));
        out.write(leShort(BLOCK_ALIGN));
        out.write(leShort(BITS_PER_SAMPLE));
        out.write(new byte[] {'d', 'a', 't', 'a'});
        out.write(leInt(dataSize));
    }

    private static byte[] leShort(int v) {
        return new byte[] {(byte) (v & 0xFF), (byte) ((v >>> 8) & 0xFF)};
    }

    private static byte[] leInt(int v) {
        return new byte[] {
                (byte) (v & 0xFF), (byte) ((v >>> 8) & 0xFF),
                (byte) ((v >>> 16) & 0xFF), (byte) ((v >>> 24) & 0xFF)};
    }
}
