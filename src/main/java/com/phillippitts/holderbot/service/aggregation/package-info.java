/**
 * Multi-region majority vote over vision oracle replies.
 *
 * <p>A photograph is cut into the fixed {@link com.phillippitts.holderbot.service.aggregation.AnalysisRegion}s,
 * each region is analysed concurrently, replies are parsed and filtered, and the survivors vote.
 */
package com.phillippitts.holderbot.service.aggregation;
