package com.phillippitts.voiceanalysis.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable analysis record: metadata, the durable audio artifact path, prediction
 * channels and tags.
 *
 * <p>{@code id} is {@code null} until the store assigns one. {@code audioPath} holds the
 * temporary source path only between insert and commit inside the persistence coordinator;
 * any record handed back to callers points at the vault artifact.
 *
 * @param id             store-assigned id, {@code null} before the first insert
 * @param title          non-blank display title
 * @param description    optional free text
 * @param sendStatus     inference lifecycle tag
 * @param errorMessage   set only when {@code sendStatus} is {@link SendStatus#ERROR}
 * @param audioPath      path of the audio artifact
 * @param creationDate   set once at creation
 * @param completionDate set when the first prediction channel arrives
 * @param channels       populated channels only; absent channels have no entry
 * @param tags           tag names, loaded separately from the row
 */
public record AnalysisRecord(
        Long id,
        String title,
        String description,
        SendStatus sendStatus,
        String errorMessage,
        String audioPath,
        Instant creationDate,
        Instant completionDate,
        Map<PredictionChannel, ChannelPrediction> channels,
        Set<String> tags
) {

    public AnalysisRecord {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(sendStatus, "sendStatus must not be null");
        Objects.requireNonNull(audioPath, "audioPath must not be null");
        Objects.requireNonNull(creationDate, "creationDate must not be null");
        EnumMap<PredictionChannel, ChannelPrediction> copy = new EnumMap<>(PredictionChannel.class);
        if (channels != null) {
            channels.forEach((channel, prediction) -> {
                if (prediction != null) {
                    copy.put(channel, prediction);
                }
            });
        }
        channels = Collections.unmodifiableMap(copy);
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    /**
     * New, not yet persisted record in {@link SendStatus#PENDING} state.
     */
    public static AnalysisRecord pending(String title, String description, String audioPath, Instant createdAt) {
        return new AnalysisRecord(null, title, description, SendStatus.PENDING, null,
                audioPath, createdAt, null, Map.of(), Set.of());
    }

    /** Prediction map for a channel, or {@code null} when the channel is empty. */
    public Map<String, Double> prediction(PredictionChannel channel) {
        ChannelPrediction p = channels.get(channel);
        return p == null ? null : p.probabilities();
    }

    /** Feedback flag for a channel, or {@code null} when unset. */
    public Boolean feedback(PredictionChannel channel) {
        ChannelPrediction p = channels.get(channel);
        return p == null ? null : p.feedback();
    }

    public boolean hasAnyPrediction() {
        return channels.values().stream().anyMatch(ChannelPrediction::hasPrediction);
    }

    public AnalysisRecord withId(long newId) {
        return new AnalysisRecord(newId, title, description, sendStatus, errorMessage,
                audioPath, creationDate, completionDate, channels, tags);
    }

    public AnalysisRecord withAudioPath(String newAudioPath) {
        return new AnalysisRecord(id, title, description, sendStatus, errorMessage,
                newAudioPath, creationDate, completionDate, channels, tags);
    }

    public AnalysisRecord withTags(Set<String> newTags) {
        return new AnalysisRecord(id, title, description, sendStatus, errorMessage,
                audioPath, creationDate, completionDate, channels, newTags);
    }
}
