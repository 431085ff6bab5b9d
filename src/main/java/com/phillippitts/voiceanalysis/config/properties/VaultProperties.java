package com.phillippitts.voiceanalysis.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the audio file vault.
 *
 * <p>The vault base directory prefers {@code vault.external-dir} (shared storage) and falls
 * back to {@code vault.private-dir} when the external location is unset or not writable.
 */
@Validated
@ConfigurationProperties(prefix = "vault")
public class VaultProperties {

    /** Shared storage root; optional. */
    private String externalDir;

    /** App-private storage root; always required as the fallback. */
    @NotBlank
    private String privateDir = System.getProperty("user.home") + "/.voice-analysis";

    /** Name of the subdirectory created under the chosen root. */
    @NotBlank
    private String folderName = "audio_analysis";

    /** Interval between background reconciliation sweeps. */
    @Min(1000)
    private long reconcileIntervalMs = 300_000;

    public String getExternalDir() {
        return externalDir;
    }

    public void setExternalDir(String externalDir) {
        this.externalDir = externalDir;
    }

    public String getPrivateDir() {
        return privateDir;
    }

    public void setPrivateDir(String privateDir) {
        this.privateDir = privateDir;
    }

    public String getFolderName() {
        return folderName;
    }

    public void setFolderName(String folderName) {
        this.folderName = folderName;
    }

    public long getReconcileIntervalMs() {
        return reconcileIntervalMs;
    }

    public void setReconcileIntervalMs(long reconcileIntervalMs) {
        this.reconcileIntervalMs = reconcileIntervalMs;
    }
}
