package com.phillippitts.voiceanalysis.service.inference;

import com.phillippitts.voiceanalysis.domain.PredictionChannel;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One channel's output from the {@link InferenceClient}.
 *
 * @param channel       channel the map belongs to
 * @param probabilities label to confidence
 * @param completedAt   when inference produced it; {@code null} for "now"
 */
public record PredictionResult(PredictionChannel channel, Map<String, Double> probabilities, Instant completedAt) {

    public PredictionResult {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(probabilities, "probabilities must not be null");
    }
}
