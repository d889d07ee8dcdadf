package com.z254.campusvoice.voice.persistence;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-complaint mutual exclusion for read-modify-write cycles.
 * <p>
 * Locks are held weakly, so complaints nobody is writing to do not pin a
 * lock in memory. Operations on different complaints never contend.
 */
@Component
public class ComplaintLockManager {

    private final Cache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build();

    public <T> T withLock(String complaintId, Supplier<T> work) {
        ReentrantLock lock = locks.get(complaintId, id -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String complaintId) {
        ReentrantLock lock = locks.getIfPresent(complaintId);
        return lock != null && lock.isLocked();
    }
}
