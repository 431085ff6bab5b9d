package com.phillippitts.voiceanalysis.service.persistence;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Published once an analysis row and its audio artifact are durable, and again when a
 * failed analysis is retried. Inference listens for it.
 *
 * @param analysisId committed id
 * @param audioPath  permanent artifact path
 * @param at         publication time
 */
public record AnalysisCreatedEvent(long analysisId, Path audioPath, Instant at) {

    public AnalysisCreatedEvent {
        Objects.requireNonNull(audioPath, "audioPath must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }
}
