package com.phillippitts.hsie.config.store;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Selects the Evidence Store implementation.
 */
@Validated
@ConfigurationProperties(prefix = "hsie.store")
public class StoreProperties {

    public enum Type { MEMORY, FILESYSTEM }

    @NotNull
    private final Type type;

    /** Directory holding {@code {id}.json} files (type=FILESYSTEM). */
    private final String baseDir;

    @ConstructorBinding
    public StoreProperties(Type type, String baseDir) {
        this.type = type == null ? Type.MEMORY : type;
        this.baseDir = baseDir == null || baseDir.isBlank() ? "data/evidence" : baseDir;
    }

    public Type getType() {
        return type;
    }

    public String getBaseDir() {
        return baseDir;
    }
}
