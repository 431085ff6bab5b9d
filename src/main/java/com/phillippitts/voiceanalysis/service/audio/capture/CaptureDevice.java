package com.phillippitts.voiceanalysis.service.audio.capture;

import java.nio.file.Path;

/**
 * Audio input that records into one file per {@link #start(Path)}.
 *
 * <p>Failures are reported as {@link com.phillippitts.voiceanalysis.exception.CaptureDeviceException}
 * and are recoverable: the caller may retry the same call. A device is driven by a single
 * owner, so implementations only need to tolerate the owner's own thread plus their
 * internal capture thread.
 */
public interface CaptureDevice {

    /** Begins capturing into {@code target}, creating or truncating it. */
    void start(Path target);

    /** Stops appending audio without closing the file. */
    void pause();

    void resume();

    /** Finishes the file. Calling stop on a stopped device does nothing. */
    void stop();
}
