package com.z254.sentinel.guardian.guard;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds the number of concurrently active verification sessions.
 * <p>
 * A verification run can produce tickets that a later automated pass re-detects, so
 * runs are admitted only while a slot is free. Acquisition never blocks: at capacity
 * {@link #tryAcquire(String)} returns empty and the caller skips the run.
 */
@Slf4j
public class RecursionGuard {

    private final int maxSessions;
    private final Clock clock;
    private final AtomicInteger active = new AtomicInteger();
    private final Set<String> sessionIds = ConcurrentHashMap.newKeySet();
    private final AtomicInteger sequence = new AtomicInteger();

    public RecursionGuard(int maxSessions, Clock clock) {
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be positive: " + maxSessions);
        }
        this.maxSessions = maxSessions;
        this.clock = clock;
    }

    public RecursionGuard(int maxSessions) {
        this(maxSessions, Clock.systemUTC());
    }

    /**
     * Reserve a session slot for the given working context.
     *
     * @return the session, or empty when all slots are taken
     */
    public Optional<Session> tryAcquire(String workingContext) {
        while (true) {
            int current = active.get();
            if (current >= maxSessions) {
                log.warn("Recursion guard at capacity ({}/{}), rejecting session for {}",
                        current, maxSessions, workingContext);
                return Optional.empty();
            }
            if (active.compareAndSet(current, current + 1)) {
                break;
            }
        }

        Instant startedAt = clock.instant();
        String id = workingContext + "-" + startedAt.toEpochMilli() + "-" + sequence.incrementAndGet();
        sessionIds.add(id);
        log.debug("Acquired verification session {} ({}/{})", id, active.get(), maxSessions);
        return Optional.of(new Session(id, startedAt));
    }

    public int getActiveSessions() {
        return active.get();
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public boolean isAtCapacity() {
        return active.get() >= maxSessions;
    }

    public Set<String> getActiveSessionIds() {
        return Set.copyOf(sessionIds);
    }

    private void release(Session session) {
        sessionIds.remove(session.getId());
        int remaining = active.decrementAndGet();
        log.debug("Released verification session {} ({}/{})", session.getId(), remaining, maxSessions);
    }

    /**
     * A held slot. Closing releases it; closing twice is a no-op.
     */
    public final class Session implements AutoCloseable {
        private final String id;
        private final Instant startedAt;
        private final AtomicBoolean released = new AtomicBoolean();

        private Session(String id, Instant startedAt) {
            this.id = id;
            this.startedAt = startedAt;
        }

        public String getId() {
            return id;
        }

        public Instant getStartedAt() {
            return startedAt;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release(this);
            }
        }
    }
}
