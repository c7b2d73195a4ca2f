package com.phillippitts.hsie.exception;

/**
 * Base exception for all pipeline errors.
 *
 * <p>Every instance knows its taxonomy {@link ErrorKind}, the {@link PipelineStage} it was raised
 * in and, where one exists, the Evidence id the failing operation was working on. Together these
 * are enough to resume a pipeline from the last committed Evidence.
 */
public abstract class HsieException extends RuntimeException {

    private final PipelineStage stage;
    private final String evidenceId;

    protected HsieException(String message, PipelineStage stage, String evidenceId) {
        super(message);
        this.stage = stage;
        this.evidenceId = evidenceId;
    }

    protected HsieException(String message, PipelineStage stage, String evidenceId, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.evidenceId = evidenceId;
    }

    public abstract ErrorKind getKind();

    public PipelineStage getStage() {
        return stage;
    }

    /**
     * @return id of the Evidence involved, or {@code null} when none exists yet (e.g. at capture)
     */
    public String getEvidenceId() {
        return evidenceId;
    }

    /**
     * One-line report in the form {@code Kind stage=<stage> evidence=<id>: message}.
     */
    public String toReport() {
        return getKind().displayName()
                + " stage=" + (stage == null ? "-" : stage.label())
                + " evidence=" + (evidenceId == null ? "-" : evidenceId)
                + ": " + getMessage();
    }
}
