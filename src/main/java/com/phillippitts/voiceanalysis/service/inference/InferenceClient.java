package com.phillippitts.voiceanalysis.service.inference;

import java.nio.file.Path;
import java.util.List;

/**
 * Black-box inference back end. Given a stored recording it returns one result per
 * prediction channel it could compute.
 *
 * <p>Not provided by this application; register a bean to enable dispatch.
 *
 * @see InferenceDispatcher
 */
public interface InferenceClient {

    /**
     * @throws com.phillippitts.voiceanalysis.exception.InferenceException when the back end
     *         reports a failure; its message is shown to the user
     */
    List<PredictionResult> analyze(long analysisId, Path audioPath);
}
