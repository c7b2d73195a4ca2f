package com.phillippitts.hsie.exception;

/**
 * A reference could not be resolved: an unknown Evidence id, an Evidence of the wrong kind for
 * the requested stage, or an analyzer that is not registered.
 */
public class NotFoundException extends HsieException {

    private final String reference;

    public NotFoundException(String message, PipelineStage stage, String reference) {
        super(message, stage, reference);
        this.reference = reference;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }

    public String getReference() {
        return reference;
    }
}
