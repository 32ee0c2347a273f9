package com.phillippitts.holderbot.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Pattern-learning store settings.
 */
@ConfigurationProperties(prefix = "holderbot.store")
public class StoreProperties {

    /** Number of per-subject lock stripes. */
    private final int lockStripes;

    @ConstructorBinding
    public StoreProperties(Integer lockStripes) {
        this.lockStripes = lockStripes == null ? 64 : lockStripes;
        if (this.lockStripes <= 0) {
            throw new IllegalArgumentException("holderbot.store.lock-stripes must be > 0");
        }
    }

    public int getLockStripes() {
        return lockStripes;
    }
}
