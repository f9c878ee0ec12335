package com.deepansh.salesagent.core;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per (user, session) so two requests for the same session never
 * interleave their read-modify-write of the session context.
 * Requests for different sessions never contend.
 *
 * Entries are reference counted and dropped when the last holder releases,
 * so the map only contains sessions with a run in flight.
 *
 * Single-instance only; a multi-node deployment would need a Redis lock.
 */
@Component
public class SessionLockRegistry {

    private final ConcurrentMap<String, SessionLock> locks = new ConcurrentHashMap<>();

    /** Blocks until the session lock is held. Pair every call with {@link #release}. */
    public void acquire(String userId, String sessionId) {
        SessionLock entry = locks.compute(key(userId, sessionId), (k, existing) -> {
            SessionLock l = existing != null ? existing : new SessionLock();
            l.holders++;
            return l;
        });
        entry.lock.lock();
    }

    public void release(String userId, String sessionId) {
        String key = key(userId, sessionId);
        SessionLock entry = locks.get(key);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session lock not held [" + key + "]");
        }
        entry.lock.unlock();
        locks.computeIfPresent(key, (k, l) -> --l.holders == 0 ? null : l);
    }

    boolean isLocked(String userId, String sessionId) {
        SessionLock entry = locks.get(key(userId, sessionId));
        return entry != null && entry.lock.isLocked();
    }

    int size() {
        return locks.size();
    }

    private static String key(String userId, String sessionId) {
        return userId + ":" + sessionId;
    }

    // holders is only touched inside the map's atomic compute calls
    private static final class SessionLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int holders;
    }
}
