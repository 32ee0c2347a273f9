/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.holderbot.exception.HolderBotException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.holderbot.exception.InvalidSubjectException} - Blank subject
 *       ids or blank correction values</li>
 *   <li>{@link com.phillippitts.holderbot.exception.StorageException} - The persistent store
 *       failed; corrections surface it, the engine write-back only logs it</li>
 *   <li>{@link com.phillippitts.holderbot.exception.VisionOracleException} - A region analysis
 *       call failed; absorbed by the aggregator as a discarded region</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support cause chaining, and map to HTTP status codes via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.holderbot.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.holderbot.exception;
