/**
 * Immutable domain model of the evidence pipeline.
 *
 * <p>{@link com.phillippitts.hsie.domain.Evidence} is the central entity; its payload is one of
 * {@link com.phillippitts.hsie.domain.RawPayload}, {@link com.phillippitts.hsie.domain.PreprocessedPayload},
 * {@link com.phillippitts.hsie.domain.AnalyzedPayload} or {@link com.phillippitts.hsie.domain.ScoredPayload},
 * matching its {@link com.phillippitts.hsie.domain.VersionKind}. All types are records with defensive
 * copies of their collections, so a committed Evidence cannot be changed through any reference.
 */
package com.phillippitts.hsie.domain;
