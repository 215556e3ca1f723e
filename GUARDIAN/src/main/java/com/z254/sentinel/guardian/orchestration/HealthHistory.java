package com.z254.sentinel.guardian.orchestration;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.HealthSnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded history of recent snapshots, oldest first. Readers always get a copy.
 */
@Component
public class HealthHistory {

    private final Deque<HealthSnapshot> snapshots = new ArrayDeque<>();
    private final int capacity;
    private final Clock clock;

    @Autowired
    public HealthHistory(GuardianProperties properties, Clock clock) {
        this(properties.getSchedule().getHistorySize(), clock);
    }

    public HealthHistory(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    /**
     * Append a snapshot, stamping it with the current time when it has none.
     *
     * @return the snapshot as stored
     */
    public synchronized HealthSnapshot append(HealthSnapshot snapshot) {
        HealthSnapshot stored = snapshot.getTimestamp() != null
                ? snapshot
                : snapshot.toBuilder().timestamp(clock.instant()).build();
        snapshots.addLast(stored);
        while (snapshots.size() > capacity) {
            snapshots.removeFirst();
        }
        return stored;
    }

    public synchronized List<HealthSnapshot> snapshots() {
        return List.copyOf(snapshots);
    }

    /**
     * The newest {@code limit} snapshots, oldest first.
     */
    public synchronized List<HealthSnapshot> recent(int limit) {
        List<HealthSnapshot> all = new ArrayList<>(snapshots);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized Optional<HealthSnapshot> latest() {
        return Optional.ofNullable(snapshots.peekLast());
    }

    public synchronized int size() {
        return snapshots.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
