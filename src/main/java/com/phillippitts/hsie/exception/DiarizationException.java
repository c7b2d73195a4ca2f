package com.phillippitts.hsie.exception;

/**
 * The diarizer collaborator failed or returned unusable turns. No Preprocessed Evidence is written.
 */
public class DiarizationException extends HsieException {

    public DiarizationException(String message, String evidenceId) {
        super(message, PipelineStage.PREPROCESSING, evidenceId);
    }

    public DiarizationException(String message, String evidenceId, Throwable cause) {
        super(message, PipelineStage.PREPROCESSING, evidenceId, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.DIARIZATION;
    }
}
