/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.holderbot.config.ThreadPoolConfig} - Bounded executor for
 *       concurrent vision oracle region calls</li>
 *   <li>{@link com.phillippitts.holderbot.config.OracleConfig} - HTTP client for the
 *       vision oracle</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code holderbot.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 */
package com.phillippitts.holderbot.config;
