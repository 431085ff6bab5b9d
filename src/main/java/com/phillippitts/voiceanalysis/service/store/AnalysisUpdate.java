package com.phillippitts.voiceanalysis.service.store;

import com.phillippitts.voiceanalysis.domain.PredictionChannel;
import com.phillippitts.voiceanalysis.domain.SendStatus;
import com.phillippitts.voiceanalysis.service.codec.ProbabilityMapCodec;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of one analysis row. Only fields that were set are written; setting a
 * field to {@code null} writes SQL NULL, which is different from leaving it unchanged.
 *
 * <pre>
 * AnalysisUpdate update = AnalysisUpdate.builder()
 *         .prediction(PredictionChannel.AGE, probabilities)
 *         .completionDate(now)
 *         .build();
 * </pre>
 */
public final class AnalysisUpdate {

    private final Map<String, Object> columns;

    private AnalysisUpdate(Map<String, Object> columns) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Column name to JDBC value, in the order the fields were set. */
    public Map<String, Object> columns() {
        return columns;
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    public boolean sets(String column) {
        return columns.containsKey(column);
    }

    @Override
    public String toString() {
        return "AnalysisUpdate" + columns.keySet();
    }

    public static final class Builder {
        private final Map<String, Object> columns = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder title(String title) {
            columns.put(AnalysisColumns.TITLE, title);
            return this;
        }

        public Builder description(String description) {
            columns.put(AnalysisColumns.DESCRIPTION, description);
            return this;
        }

        public Builder sendStatus(SendStatus status) {
            columns.put(AnalysisColumns.SEND_STATUS, status.code());
            return this;
        }

        public Builder errorMessage(String message) {
            columns.put(AnalysisColumns.ERROR_MESSAGE, message);
            return this;
        }

        public Builder audioPath(String audioPath) {
            columns.put(AnalysisColumns.RECORDING_PATH, audioPath);
            return this;
        }

        public Builder completionDate(Instant completionDate) {
            columns.put(AnalysisColumns.COMPLETION_DATE,
                    completionDate == null ? null : completionDate.toString());
            return this;
        }

        /** Encodes the map with {@link ProbabilityMapCodec}; {@code null} clears the channel. */
        public Builder prediction(PredictionChannel channel, Map<String, Double> probabilities) {
            columns.put(channel.resultColumn(), ProbabilityMapCodec.encode(probabilities));
            return this;
        }

        /** Stored as 1, 0 or NULL. */
        public Builder feedback(PredictionChannel channel, Boolean feedback) {
            columns.put(channel.feedbackColumn(), feedback == null ? null : (feedback ? 1 : 0));
            return this;
        }

        public AnalysisUpdate build() {
            return new AnalysisUpdate(columns);
        }
    }
}
