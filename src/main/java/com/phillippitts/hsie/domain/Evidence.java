package com.phillippitts.hsie.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable, versioned snapshot of derived data with explicit provenance to its parent.
 *
 * <p>{@code id} is the content address of {@code (versionKind, parentId, payload)};
 * {@code createdAt} and {@code producer} are audit metadata outside the address. Instances are
 * created through {@link com.phillippitts.hsie.service.store.EvidenceFactory}, which computes the
 * id, and are owned by the {@link com.phillippitts.hsie.service.store.EvidenceStore} once committed.
 *
 * @param id          content hash (lowercase hex SHA-256)
 * @param versionKind lineage position
 * @param parentId    id of the Evidence this one was derived from; {@code null} only for RAW
 * @param createdAt   commit timestamp
 * @param producer    identity of the stage that produced it
 * @param payload     version-specific content; its kind must equal {@code versionKind}
 */
public record Evidence(
        String id,
        VersionKind versionKind,
        String parentId,
        Instant createdAt,
        String producer,
        EvidencePayload payload
) {

    public Evidence {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(versionKind, "versionKind must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(producer, "producer must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (payload.kind() != versionKind) {
            throw new IllegalArgumentException(
                    "Payload kind " + payload.kind() + " does not match version kind " + versionKind);
        }
    }

    public boolean isRoot() {
        return parentId == null;
    }

    /**
     * Returns the payload cast to the expected type.
     *
     * @throws IllegalStateException if the payload is of another type
     */
    public <T extends EvidencePayload> T payloadAs(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException("Evidence " + id + " carries " + payload.getClass().getSimpleName()
                    + ", not " + type.getSimpleName());
        }
        return type.cast(payload);
    }
}
