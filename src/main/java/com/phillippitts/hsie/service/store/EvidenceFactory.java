package com.phillippitts.hsie.service.store;

import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.EvidencePayload;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;

/**
 * Creates Evidence with its content address computed from kind, parent and payload.
 *
 * <p>Stages never assign ids themselves; equal (payload, parent) pairs always get the same id.
 */
@Component
public class EvidenceFactory {

    private final Clock clock;

    public EvidenceFactory(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Evidence create(String parentId, String producer, EvidencePayload payload) {
        Objects.requireNonNull(payload, "payload");
        return new Evidence(
                addressOf(parentId, payload),
                payload.kind(),
                parentId,
                clock.instant(),
                producer,
                payload);
    }

    public static String addressOf(String parentId, EvidencePayload payload) {
        return ContentAddress.sha256Hex(EvidenceJsonCodec.contentOf(payload.kind(), parentId, payload));
    }

    /**
     * @return the content address recomputed from the Evidence's own fields
     */
    public static String addressOf(Evidence evidence) {
        return ContentAddress.sha256Hex(
                EvidenceJsonCodec.contentOf(evidence.versionKind(), evidence.parentId(), evidence.payload()));
    }
}
