package com.phillippitts.holderbot.service.store;

import com.phillippitts.holderbot.config.properties.StoreProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-subject locks. Two ids may share a stripe, which only costs parallelism;
 * one id always maps to the same lock.
 */
@Component
public class SubjectLockRegistry {

    private final ReentrantLock[] stripes;

    @Autowired
    public SubjectLockRegistry(StoreProperties properties) {
        this(properties.getLockStripes());
    }

    public SubjectLockRegistry(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be > 0");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String subjectId, Supplier<T> action) {
        ReentrantLock lock = lockFor(subjectId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} holding the stripes of every given id, taken in ascending stripe
     * order and each only once.
     */
    public <T> T withLocks(Collection<String> subjectIds, Supplier<T> action) {
        TreeSet<Integer> indexes = new TreeSet<>();
        for (String id : subjectIds) {
            indexes.add(stripeIndex(id));
        }
        Deque<ReentrantLock> held = new ArrayDeque<>(indexes.size());
        try {
            for (int i : indexes) {
                ReentrantLock lock = stripes[i];
                lock.lock();
                held.push(lock);
            }
            return action.get();
        } finally {
            while (!held.isEmpty()) {
                held.pop().unlock();
            }
        }
    }

    ReentrantLock lockFor(String subjectId) {
        return stripes[stripeIndex(subjectId)];
    }

    private int stripeIndex(String subjectId) {
        return Math.floorMod(subjectId.hashCode(), stripes.length);
    }
}
