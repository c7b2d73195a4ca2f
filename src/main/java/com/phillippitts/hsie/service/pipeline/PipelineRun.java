package com.phillippitts.hsie.service.pipeline;

import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.ScoredPayload;

/**
 * Evidence chain produced by one end-to-end run, root first.
 */
public record PipelineRun(Evidence raw, Evidence preprocessed, Evidence analyzed, Evidence scored) {

    public ScoredPayload score() {
        return scored.payloadAs(ScoredPayload.class);
    }
}
