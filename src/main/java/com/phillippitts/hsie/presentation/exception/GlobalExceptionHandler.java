package com.phillippitts.hsie.presentation.exception;

import com.phillippitts.hsie.exception.DiarizationException;
import com.phillippitts.hsie.exception.HsieException;
import com.phillippitts.hsie.exception.InsufficientEvidenceException;
import com.phillippitts.hsie.exception.IntegrityException;
import com.phillippitts.hsie.exception.NotFoundException;
import com.phillippitts.hsie.exception.TranscriptionException;
import com.phillippitts.hsie.exception.TranscriptionFailureReason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts pipeline exceptions to HTTP responses; {@code errorCode} is the taxonomy name
 * (e.g. {@code IntegrityError}) and {@code details} the one-line report with stage and Evidence id.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown id, wrong Evidence kind for the stage, or unregistered analyzer (HTTP 404).
     */
    @ExceptionHandler(NotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(NotFoundException ex) {
        LOG.warn("Not found: {}", ex.toReport());
        return respond(HttpStatus.NOT_FOUND, ex, "Referenced Evidence or analyzer not available");
    }

    /**
     * Lineage or content-address violation (HTTP 409).
     */
    @ExceptionHandler(IntegrityException.class)
    ResponseEntity<ApiError> handleIntegrity(IntegrityException ex) {
        LOG.error("Integrity violation: {}", ex.toReport(), ex);
        return respond(HttpStatus.CONFLICT, ex, "Evidence integrity check failed");
    }

    /**
     * Input problems are 422; engine trouble is transient (HTTP 503).
     */
    @ExceptionHandler(TranscriptionException.class)
    ResponseEntity<ApiError> handleTranscriptionFailure(TranscriptionException ex) {
        boolean engineSide = ex.getReason() == TranscriptionFailureReason.TIMEOUT
                || ex.getReason() == TranscriptionFailureReason.ENGINE_FAILURE;
        if (engineSide) {
            LOG.error("Transcription failed: engine={}, reason={}", ex.getEngineName(), ex.getReason(), ex);
            return respond(HttpStatus.SERVICE_UNAVAILABLE, ex, "Transcription service temporarily unavailable");
        }
        LOG.warn("Transcription rejected: engine={}, reason={}", ex.getEngineName(), ex.getReason());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex, "Audio could not be transcribed");
    }

    @ExceptionHandler(DiarizationException.class)
    ResponseEntity<ApiError> handleDiarization(DiarizationException ex) {
        LOG.error("Diarization failed: {}", ex.toReport(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex, "Diarization service temporarily unavailable");
    }

    @ExceptionHandler(InsufficientEvidenceException.class)
    ResponseEntity<ApiError> handleInsufficientEvidence(InsufficientEvidenceException ex) {
        LOG.warn("Insufficient evidence: {}", ex.toReport());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex, "Nothing to score");
    }

    @ExceptionHandler(HsieException.class)
    ResponseEntity<ApiError> handlePipelineFailure(HsieException ex) {
        LOG.error("Pipeline failure: {}", ex.toReport(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Pipeline failure");
    }

    /**
     * Client error - invalid request (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("BadRequest", "Invalid request", ex.getMessage(), Instant.now()));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, HsieException ex, String message) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getKind().displayName(), message, ex.toReport(), Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
