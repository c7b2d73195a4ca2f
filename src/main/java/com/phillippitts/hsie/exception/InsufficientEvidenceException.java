package com.phillippitts.hsie.exception;

/**
 * Aggregation input carries nothing that can be scored. Terminal for that aggregation call.
 */
public class InsufficientEvidenceException extends HsieException {

    public InsufficientEvidenceException(String message, String evidenceId) {
        super(message, PipelineStage.AGGREGATION, evidenceId);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INSUFFICIENT_EVIDENCE;
    }
}
