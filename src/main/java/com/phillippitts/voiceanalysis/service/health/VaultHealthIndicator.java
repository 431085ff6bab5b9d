package com.phillippitts.voiceanalysis.service.health;

import com.phillippitts.voiceanalysis.service.persistence.UnresolvedAnalysisRegistry;
import com.phillippitts.voiceanalysis.service.vault.FileVault;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health indicator for the audio vault.
 *
 * <p>DOWN when the base directory is missing or not writable. Ids awaiting reconciliation
 * are reported as a detail without affecting the status.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class VaultHealthIndicator implements HealthIndicator {

    private final FileVault vault;
    private final UnresolvedAnalysisRegistry unresolved;

    public VaultHealthIndicator(FileVault vault, UnresolvedAnalysisRegistry unresolved) {
        this.vault = vault;
        this.unresolved = unresolved;
    }

    @Override
    public Health health() {
        Path base = vault.baseDirectory();
        boolean exists = Files.isDirectory(base);
        boolean writable = exists && Files.isWritable(base);

        Health.Builder builder = writable ? Health.up() : Health.down();
        return builder
                .withDetail("baseDirectory", formatStatus(exists, writable, base))
                .withDetail("unresolved", unresolved.size())
                .build();
    }

    private String formatStatus(boolean exists, boolean writable, Path path) {
        if (!exists) {
            return "NOT FOUND at " + path;
        }
        if (!writable) {
            return "not writable at " + path;
        }
        return "writable at " + path;
    }
}
