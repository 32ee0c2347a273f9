package com.phillippitts.holderbot.service.events;

import java.time.Instant;

/**
 * Published when one analysis region produced no usable reply (timeout, oracle error,
 * unparseable reply). Carries no image data and no reply text.
 */
public record RegionAnalysisFailedEvent(String subjectId, String region, String reason, Instant at) {
    public RegionAnalysisFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
