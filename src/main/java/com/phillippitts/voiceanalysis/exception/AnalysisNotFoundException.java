package com.phillippitts.voiceanalysis.exception;

/**
 * Thrown when a write operation targets an analysis id that has no stored row.
 */
public class AnalysisNotFoundException extends VoiceAnalysisException {

    private final long analysisId;

    public AnalysisNotFoundException(long analysisId) {
        super("Analysis not found: " + analysisId);
        this.analysisId = analysisId;
    }

    public long getAnalysisId() {
        return analysisId;
    }
}
