package com.phillippitts.voiceanalysis.domain;

/**
 * Lifecycle tag governing whether inference has been requested or completed.
 * The numeric code is the persisted wire value.
 */
public enum SendStatus {
    PENDING(0),
    SENT(1),
    ERROR(2);

    private final int code;

    SendStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolves a persisted code.
     *
     * @throws IllegalArgumentException for an unknown code
     */
    public static SendStatus fromCode(int code) {
        for (SendStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown send status code: " + code);
    }
}
