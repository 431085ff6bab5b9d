package com.phillippitts.voiceanalysis.domain;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One channel's prediction state: the label-to-confidence map and the user's feedback
 * on the top prediction.
 *
 * @param probabilities label to confidence, {@code null} when inference never filled this channel
 * @param feedback      {@code true}/{@code false} when the user confirmed/rejected, {@code null} if unset
 */
public record ChannelPrediction(Map<String, Double> probabilities, Boolean feedback) {

    /**
     * @throws IllegalArgumentException if feedback is set without probabilities
     */
    public ChannelPrediction {
        if (probabilities == null && feedback != null) {
            throw new IllegalArgumentException("Feedback requires a prediction map");
        }
        probabilities = probabilities == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(probabilities));
    }

    public static ChannelPrediction of(Map<String, Double> probabilities) {
        return new ChannelPrediction(probabilities, null);
    }

    public boolean hasPrediction() {
        return probabilities != null;
    }

    /** Label with the highest confidence; ties resolve to the first label in map order. */
    public Optional<String> topLabel() {
        if (probabilities == null || probabilities.isEmpty()) {
            return Optional.empty();
        }
        return probabilities.entrySet().stream()
                .max(Comparator.comparingDouble(Map.Entry::getValue))
                .map(Map.Entry::getKey);
    }

    public ChannelPrediction withFeedback(Boolean newFeedback) {
        return new ChannelPrediction(probabilities, newFeedback);
    }
}
