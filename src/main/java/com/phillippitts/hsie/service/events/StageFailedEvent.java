package com.phillippitts.hsie.service.events;

import com.phillippitts.hsie.exception.PipelineStage;

import java.time.Instant;

/**
 * Emitted when a stage aborts without committing Evidence.
 *
 * @param stage      failing stage
 * @param evidenceId input Evidence id (null at capture)
 * @param errorKind  taxonomy name, e.g. {@code IntegrityError}
 * @param report     one-line error report
 * @param timestamp  when the failure was observed
 */
public record StageFailedEvent(
        PipelineStage stage,
        String evidenceId,
        String errorKind,
        String report,
        Instant timestamp
) {}
