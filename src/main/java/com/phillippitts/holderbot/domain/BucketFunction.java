package com.phillippitts.holderbot.domain;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Cheap deterministic projections of a numeric subject id used as pattern-learning buckets.
 *
 * <p>The {@link #key()} is the value persisted in {@code pattern_hypothesis.bucket_type}.
 */
public enum BucketFunction {

    MOD_10("mod10") {
        @Override
        public long apply(long id) {
            return id % 10;
        }
    },
    MOD_15("mod15") {
        @Override
        public long apply(long id) {
            return id % 15;
        }
    },
    MOD_20("mod20") {
        @Override
        public long apply(long id) {
            return id % 20;
        }
    },
    DIV_50("div50") {
        @Override
        public long apply(long id) {
            return id / 50;
        }
    },
    DIV_100("div100") {
        @Override
        public long apply(long id) {
            return id / 100;
        }
    };

    private static final Pattern NUMERIC = Pattern.compile("\\d{1,18}");

    private final String key;

    BucketFunction(String key) {
        this.key = key;
    }

    /**
     * Bucket value of a numeric subject id.
     */
    public abstract long apply(long id);

    public String key() {
        return key;
    }

    /**
     * Resolves a persisted bucket key back to its function.
     *
     * @param key persisted key such as {@code mod10}
     * @return matching function, or empty for unknown keys
     */
    public static Optional<BucketFunction> fromKey(String key) {
        for (BucketFunction f : values()) {
            if (f.key.equals(key)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a subject id as a non-negative number. Anything else (letters, signs, blanks,
     * more than 18 digits) yields empty; callers skip pattern learning in that case.
     */
    public static OptionalLong numericId(String subjectId) {
        if (subjectId == null) {
            return OptionalLong.empty();
        }
        String trimmed = subjectId.trim();
        if (!NUMERIC.matcher(trimmed).matches()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Long.parseLong(trimmed));
    }
}
