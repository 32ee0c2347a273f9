/**
 * Immutable domain model: observations, subject records, corrections, learned bucket
 * hypotheses and calibration projections.
 *
 * <p>Material and type are plain strings. The vocabulary is data, so nothing here
 * enumerates the known values.
 */
package com.phillippitts.holderbot.domain;
