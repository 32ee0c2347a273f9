package com.phillippitts.holderbot.service.health;

import com.phillippitts.holderbot.exception.StorageException;
import com.phillippitts.holderbot.service.store.PatternLearningStore;
import com.phillippitts.holderbot.service.store.StoreStatistics;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the pattern-learning store.
 *
 * <ul>
 *   <li>UP: store reachable; record, correction and hypothesis counts reported</li>
 *   <li>DOWN: store unreachable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class StoreHealthIndicator implements HealthIndicator {

    private final PatternLearningStore store;

    public StoreHealthIndicator(PatternLearningStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        try {
            StoreStatistics stats = store.statistics();
            return Health.up()
                    .withDetail("records", stats.analysed())
                    .withDetail("verified", stats.verified())
                    .withDetail("corrections", stats.corrections())
                    .withDetail("hypotheses", stats.hypotheses())
                    .build();
        } catch (StorageException e) {
            return Health.down()
                    .withDetail("status", "Store unreachable")
                    .withDetail("operation", e.getOperation())
                    .build();
        }
    }
}
