/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.hsie.exception.NotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.hsie.exception.IntegrityException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.hsie.exception.TranscriptionException} → 422, or 503 for timeouts and engine failures</li>
 *   <li>{@link com.phillippitts.hsie.exception.InsufficientEvidenceException} → 422 Unprocessable Entity</li>
 *   <li>{@link com.phillippitts.hsie.exception.DiarizationException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "NotFoundError",
 *   "message": "Referenced Evidence or analyzer not available",
 *   "details": "NotFoundError stage=preprocessing evidence=3f2a...: Evidence 3f2a... is Analyzed, ...",
 *   "timestamp": "2026-03-02T09:12:44.101Z"
 * }
 * </pre>
 */
package com.phillippitts.hsie.presentation.exception;
