package com.phillippitts.hsie.exception;

/**
 * Lineage or versioning violation. Always fatal: it indicates a programming error or data
 * corruption and is never retried.
 */
public class IntegrityException extends HsieException {

    public IntegrityException(String message, PipelineStage stage, String evidenceId) {
        super(message, stage, evidenceId);
    }

    public IntegrityException(String message, PipelineStage stage, String evidenceId, Throwable cause) {
        super(message, stage, evidenceId, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INTEGRITY;
    }
}
