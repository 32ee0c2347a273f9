/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code subjectId} - Subject being decided, set by the decision engine</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 15:42:32.529 [thread-name] [requestId] [subjectId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.holderbot.config.logging.MdcFilter
 */
package com.phillippitts.holderbot.config.logging;
