package com.phillippitts.holderbot.service.events;

import java.time.Instant;

/**
 * Published when the engine could not store a decision. The decision itself was still
 * returned to the caller.
 */
public record WriteBackFailedEvent(String subjectId, String reason, Instant at) { }
