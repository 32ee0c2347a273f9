/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception mapping:
 * <ul>
 *   <li>{@link com.phillippitts.holderbot.exception.InvalidSubjectException},
 *       {@code IllegalArgumentException}, bean validation failures → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.holderbot.exception.StorageException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.holderbot.exception.VisionOracleException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response format:
 * <pre>
 * {
 *   "errorCode": "InvalidSubjectException",
 *   "message": "Invalid subject",
 *   "details": "subject id must not be blank",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 * 5xx bodies never carry exception messages.
 */
package com.phillippitts.holderbot.presentation.exception;
