package com.phillippitts.hsie.service.events;

import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.exception.PipelineStage;

import java.time.Instant;

/**
 * Emitted after a stage committed (or re-resolved) an Evidence in the store.
 *
 * @param stage     stage that produced the Evidence
 * @param evidence  the committed Evidence
 * @param timestamp when the stage finished
 */
public record EvidenceCommittedEvent(PipelineStage stage, Evidence evidence, Instant timestamp) {}
