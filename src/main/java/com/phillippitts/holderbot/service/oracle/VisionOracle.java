package com.phillippitts.holderbot.service.oracle;

import com.phillippitts.holderbot.exception.VisionOracleException;

/**
 * External multimodal analysis service, treated as unreliable and slow.
 *
 * <p>Implementations must be thread-safe: the aggregator calls {@link #analyze} for several
 * regions of one photograph concurrently.
 */
public interface VisionOracle {

    /**
     * Sends one region with an instruction and returns the raw reply text.
     *
     * @throws VisionOracleException on transport failure, error status or empty reply
     */
    String analyze(RegionImage image, String instruction);

    /**
     * Whether the oracle is configured to accept calls at all (e.g. an API key is present).
     */
    boolean isAvailable();
}
