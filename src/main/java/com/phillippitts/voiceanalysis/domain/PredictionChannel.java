package com.phillippitts.voiceanalysis.domain;

import java.util.Locale;

/**
 * Named prediction category. Each channel owns a label-to-confidence map and a
 * feedback flag, persisted in its own pair of columns.
 */
public enum PredictionChannel {
    AGE,
    GENDER,
    NATIONALITY,
    EMOTION;

    public String resultColumn() {
        return name() + "_RESULT";
    }

    public String feedbackColumn() {
        return name() + "_USER_FEEDBACK";
    }

    /**
     * Case-insensitive lookup used at the REST boundary.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static PredictionChannel parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Channel name must not be blank");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
