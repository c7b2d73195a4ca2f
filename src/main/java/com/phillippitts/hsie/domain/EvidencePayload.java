package com.phillippitts.hsie.domain;

/**
 * Version-specific content of an {@link Evidence}. Implementations are immutable records.
 */
public interface EvidencePayload {

    /**
     * @return the Evidence kind this payload belongs to
     */
    VersionKind kind();
}
