package com.phillippitts.voiceanalysis.service.store;

/**
 * Column names of the {@code AUDIO_ANALYSIS} table. Channel columns come from
 * {@link com.phillippitts.voiceanalysis.domain.PredictionChannel}.
 */
final class AnalysisColumns {

    static final String TABLE = "AUDIO_ANALYSIS";
    static final String ID = "ID";
    static final String TITLE = "TITLE";
    static final String DESCRIPTION = "DESCRIPTION";
    static final String SEND_STATUS = "SEND_STATUS";
    static final String ERROR_MESSAGE = "ERROR_MESSAGE";
    static final String RECORDING_PATH = "RECORDING_PATH";
    static final String CREATION_DATE = "CREATION_DATE";
    static final String COMPLETION_DATE = "COMPLETION_DATE";

    private AnalysisColumns() {
    }
}
