package com.phillippitts.holderbot.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for degraded-mode events. Throttled per reason to avoid log spam when
 * the oracle or the database is down for a while.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onRegionAnalysisFailed(RegionAnalysisFailedEvent e) {
        String key = "region-" + e.region() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Region analysis failed: region={}, reason={}, subject={}. "
                    + "Check holderbot.oracle.* settings and oracle availability.",
                    e.region(), e.reason(), e.subjectId());
        }
    }

    @EventListener
    void onWriteBackFailed(WriteBackFailedEvent e) {
        if (shouldLog("write-back-" + e.reason())) {
            LOG.warn("Decision write-back failed: reason={}, subject={}. "
                    + "Decisions are still returned but not cached.", e.reason(), e.subjectId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
