package com.phillippitts.voiceanalysis.service.audio.capture;

import java.util.UUID;

/**
 * Creates one {@link CaptureDevice} per recording session.
 */
@FunctionalInterface
public interface CaptureDeviceFactory {

    CaptureDevice create(UUID sessionId);
}
