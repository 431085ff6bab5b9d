package com.phillippitts.voiceanalysis.service.health;

import com.phillippitts.voiceanalysis.config.properties.VaultProperties;
import com.phillippitts.voiceanalysis.service.persistence.UnresolvedAnalysisRegistry;
import com.phillippitts.voiceanalysis.service.vault.FileVault;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class VaultHealthIndicatorTest {

    @TempDir
    Path tempDir;

    @Test
    void reportsUpWhenBaseDirectoryWritable() throws IOException {
        FileVault vault = vault();
        Files.createDirectories(vault.baseDirectory());
        UnresolvedAnalysisRegistry unresolved = new UnresolvedAnalysisRegistry();
        unresolved.flagOrphaned(4, "locked");

        Health health = new VaultHealthIndicator(vault, unresolved).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails().get("baseDirectory").toString()).startsWith("writable at");
        assertThat(health.getDetails()).containsEntry("unresolved", 1);
    }

    @Test
    void reportsDownWhenBaseDirectoryMissing() {
        Health health = new VaultHealthIndicator(vault(), new UnresolvedAnalysisRegistry()).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails().get("baseDirectory").toString()).startsWith("NOT FOUND");
    }

    private FileVault vault() {
        VaultProperties props = new VaultProperties();
        props.setPrivateDir(tempDir.resolve("private").toString());
        return new FileVault(props);
    }
}
