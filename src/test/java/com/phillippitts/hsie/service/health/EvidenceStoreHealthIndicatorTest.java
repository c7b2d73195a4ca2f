package com.phillippitts.hsie.service.health;

import com.phillippitts.hsie.service.store.EvidenceStore;
import com.phillippitts.hsie.service.store.FileSystemEvidenceStore;
import com.phillippitts.hsie.service.store.InMemoryEvidenceStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EvidenceStoreHealthIndicatorTest {

    @TempDir
    Path dir;

    @Test
    void inMemoryStoreIsUp() {
        Health health = new EvidenceStoreHealthIndicator(new InMemoryEvidenceStore()).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("type", "InMemoryEvidenceStore")
                .containsEntry("evidenceCount", 0);
    }

    @Test
    void fileSystemStoreReportsDirectory() {
        Path base = dir.resolve("evidence");

        Health health = new EvidenceStoreHealthIndicator(new FileSystemEvidenceStore(base)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("baseDir", base.toString());
    }

    @Test
    void missingDirectoryIsDown() throws IOException {
        Path base = dir.resolve("evidence");
        FileSystemEvidenceStore store = new FileSystemEvidenceStore(base);
        Files.delete(base);

        Health health = new EvidenceStoreHealthIndicator(store).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void failingStoreIsDown() {
        EvidenceStore store = mock(EvidenceStore.class);
        when(store.size()).thenThrow(new IllegalStateException("index corrupted"));

        Health health = new EvidenceStoreHealthIndicator(store).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Store unavailable");
    }
}
