/**
 * Service layer: decisions, learning, calibration and their adapters.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.ensemble} - the ensemble decision engine, its observation sources and
 *       batch decisions</li>
 *   <li>{@code service.aggregation} - multi-region photograph analysis through the vision oracle</li>
 *   <li>{@code service.store} - the pattern-learning store (records, correction log, hypotheses)</li>
 *   <li>{@code service.calibration} - confidence calibration and error analysis</li>
 *   <li>{@code service.voting} - the weighted vote shared by the engine and the aggregator</li>
 *   <li>{@code service.oracle}, {@code service.photo} - external image analysis and photographs</li>
 * </ul>
 *
 * <p>Services are Spring beans with constructor injection. They throw domain exceptions from
 * {@code com.phillippitts.holderbot.exception}, never HTTP exceptions.
 *
 * @see com.phillippitts.holderbot.service.ensemble.EnsembleDecisionEngine
 * @see com.phillippitts.holderbot.service.store.PatternLearningStore
 */
package com.phillippitts.holderbot.service;
