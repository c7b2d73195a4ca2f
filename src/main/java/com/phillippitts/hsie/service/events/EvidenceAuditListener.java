package com.phillippitts.hsie.service.events;

import com.phillippitts.hsie.domain.Evidence;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes one audit line per committed Evidence and per failed stage to the {@code hsie.audit} logger.
 * Payload content (transcripts in particular) is never written here.
 */
@Component
class EvidenceAuditListener {

    static final String AUDIT_LOGGER = "hsie.audit";

    private static final Logger AUDIT = LogManager.getLogger(AUDIT_LOGGER);

    @EventListener
    void onCommitted(EvidenceCommittedEvent e) {
        Evidence ev = e.evidence();
        AUDIT.info("COMMIT stage={} id={} kind={} parent={} producer={} created_at={}",
                e.stage().label(), ev.id(), ev.versionKind().wireName(),
                ev.parentId() == null ? "-" : ev.parentId(), ev.producer(), ev.createdAt());
    }

    @EventListener
    void onFailed(StageFailedEvent e) {
        AUDIT.warn("FAIL stage={} input={} error={} report=\"{}\"", e.stage().label(),
                e.evidenceId() == null ? "-" : e.evidenceId(), e.errorKind(), e.report());
    }
}
