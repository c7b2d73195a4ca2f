/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - one per HTTP request, set by {@link com.phillippitts.hsie.config.logging.MdcFilter}</li>
 *   <li>{@code stage} - pipeline stage currently running</li>
 *   <li>{@code evidenceId} - input Evidence of that stage</li>
 * </ul>
 *
 * <p>Both are propagated to analysis worker threads by the executor's task decorator.
 */
package com.phillippitts.hsie.config.logging;
