package com.phillippitts.voiceanalysis.config;

import com.phillippitts.voiceanalysis.config.properties.AudioCaptureProperties;
import com.phillippitts.voiceanalysis.config.properties.RecordingProperties;
import com.phillippitts.voiceanalysis.service.audio.capture.CaptureDeviceFactory;
import com.phillippitts.voiceanalysis.service.audio.capture.JavaSoundCaptureDevice;
import com.phillippitts.voiceanalysis.service.persistence.PersistenceCoordinator;
import com.phillippitts.voiceanalysis.service.recording.RecordingSessionRegistry;
import com.phillippitts.voiceanalysis.service.recording.TempRecordingFiles;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;

/**
 * Wires recording sessions to the microphone and the countdown scheduler.
 *
 * <p>Test configurations replace {@link CaptureDeviceFactory} with a {@code @Primary} fake.
 */
@Configuration
public class RecordingConfig {

    @Bean
    public CaptureDeviceFactory captureDeviceFactory(AudioCaptureProperties audioCaptureProperties,
                                                     ApplicationEventPublisher publisher) {
        return sessionId -> new JavaSoundCaptureDevice(audioCaptureProperties, publisher, sessionId);
    }

    @Bean
    public RecordingSessionRegistry recordingSessionRegistry(CaptureDeviceFactory captureDeviceFactory,
                                                             TempRecordingFiles tempRecordingFiles,
                                                             @Qualifier("recordingScheduler") TaskScheduler scheduler,
                                                             PersistenceCoordinator coordinator,
                                                             ApplicationEventPublisher publisher,
                                                             RecordingProperties recordingProperties,
                                                             Clock clock) {
        return new RecordingSessionRegistry(captureDeviceFactory, tempRecordingFiles, scheduler, coordinator,
                publisher, recordingProperties.getTickPeriod(), recordingProperties.getMaxDurationSeconds(), clock);
    }
}
