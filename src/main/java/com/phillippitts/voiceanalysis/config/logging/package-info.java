/**
 * Logging infrastructure and MDC (Log4j2 ThreadContext) configuration.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId} - X-Request-ID header or a generated UUID</li>
 *   <li>{@code method}, {@code uri} - the HTTP request</li>
 *   <li>{@code analysisId} - set by the filter for analysis paths and by the coordinator
 *       and inference dispatcher while they work on one record</li>
 * </ul>
 *
 * <p>Executors copy the context to worker threads, see
 * {@link com.phillippitts.voiceanalysis.config.ThreadPoolConfig}.
 *
 * @see com.phillippitts.voiceanalysis.config.logging.MdcFilter
 */
package com.phillippitts.voiceanalysis.config.logging;
