package com.schoolsched.schoolsched_api.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.schoolsched.schoolsched_api.exception.ScheduleBusyException;

/**
 * One in-flight generation, publish or delete per (academic year, session, class).
 * A second caller is refused instead of queued.
 */
@Component
public class ScheduleLockRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleLockRegistry.class);

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        if (!lock.tryLock()) {
            logger.warn("Rejected concurrent schedule request for {}", key);
            throw new ScheduleBusyException(key);
        }
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }
}
