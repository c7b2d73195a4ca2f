/**
 * Pipeline error taxonomy.
 *
 * <p>All exceptions extend {@link com.phillippitts.hsie.exception.HsieException}, which carries
 * the {@link com.phillippitts.hsie.exception.ErrorKind}, the originating
 * {@link com.phillippitts.hsie.exception.PipelineStage} and the Evidence id involved:
 * <ul>
 *   <li>{@link com.phillippitts.hsie.exception.TranscriptionException} - capture-time failure of the
 *       ASR collaborator, terminal for that capture</li>
 *   <li>{@link com.phillippitts.hsie.exception.IntegrityException} - lineage/versioning violation,
 *       always fatal</li>
 *   <li>{@link com.phillippitts.hsie.exception.NotFoundException} - unresolvable reference</li>
 *   <li>{@link com.phillippitts.hsie.exception.PartialAnalysisException} - one analyzer failing on one
 *       segment; recorded inline, never propagated</li>
 *   <li>{@link com.phillippitts.hsie.exception.InsufficientEvidenceException} - nothing to aggregate</li>
 *   <li>{@link com.phillippitts.hsie.exception.DiarizationException} - the diarizer collaborator failed,
 *       terminal for that preprocessing call</li>
 * </ul>
 *
 * <p>Structural violations propagate to the caller; none of them is retried automatically.
 *
 * @see com.phillippitts.hsie.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.hsie.exception;
