package com.phillippitts.voiceanalysis;

import com.phillippitts.voiceanalysis.config.properties.AudioCaptureProperties;
import com.phillippitts.voiceanalysis.config.properties.RecordingProperties;
import com.phillippitts.voiceanalysis.config.properties.VaultProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        RecordingProperties.class,
        VaultProperties.class,
        AudioCaptureProperties.class
})
@EnableScheduling
public class VoiceAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceAnalysisApplication.class, args);
    }

}
