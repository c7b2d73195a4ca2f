package com.phillippitts.hsie.service.health;

import com.phillippitts.hsie.service.store.EvidenceStore;
import com.phillippitts.hsie.service.store.FileSystemEvidenceStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health indicator for the Evidence Store.
 *
 * <ul>
 *   <li>UP: store readable (and, for the file-system store, its directory writable)</li>
 *   <li>DOWN: store directory missing or not writable, or the store failed to answer</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class EvidenceStoreHealthIndicator implements HealthIndicator {

    private final EvidenceStore store;

    public EvidenceStoreHealthIndicator(EvidenceStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        try {
            builder.withDetail("type", store.getClass().getSimpleName())
                    .withDetail("evidenceCount", store.size());
            if (store instanceof FileSystemEvidenceStore fs) {
                Path dir = fs.getBaseDir();
                builder.withDetail("baseDir", dir.toString());
                if (!Files.isDirectory(dir) || !Files.isWritable(dir)) {
                    return builder.down().withDetail("status", "Store directory not writable").build();
                }
            }
            return builder.up().withDetail("status", "Store operational").build();
        } catch (RuntimeException e) {
            return builder.down(e).withDetail("status", "Store unavailable").build();
        }
    }
}
