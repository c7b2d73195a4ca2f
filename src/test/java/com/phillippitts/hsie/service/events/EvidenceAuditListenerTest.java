package com.phillippitts.hsie.service.events;

import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.exception.PipelineStage;
import com.phillippitts.hsie.service.store.EvidenceFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.phillippitts.hsie.testutil.EvidenceFixtures.fixedClock;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.raw;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.word;
import static org.assertj.core.api.Assertions.assertThatCode;

class EvidenceAuditListenerTest {

    @Test
    void handlersDoNotThrow() {
        EvidenceAuditListener listener = new EvidenceAuditListener();
        Evidence raw = new EvidenceFactory(fixedClock()).create(null, "entry-stage", raw(word(0, "hi", 0.0, 0.3)));

        assertThatCode(() -> {
            listener.onCommitted(new EvidenceCommittedEvent(PipelineStage.ENTRY, raw, Instant.now()));
            listener.onFailed(new StageFailedEvent(PipelineStage.PREPROCESSING, raw.id(), "DiarizationError",
                    "DiarizationError stage=preprocessing evidence=" + raw.id() + ": diarizer unavailable",
                    Instant.now()));
            listener.onFailed(new StageFailedEvent(PipelineStage.ENTRY, null, "TranscriptionError", "engine crashed",
                    Instant.now()));
        }).doesNotThrowAnyException();
    }
}
