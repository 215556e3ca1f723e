package com.z254.sentinel.guardian.orchestration;

import com.z254.sentinel.guardian.MutableClock;
import com.z254.sentinel.guardian.domain.model.HealthSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthHistoryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

    @Test
    void keepsNewestSnapshotsUpToCapacity() {
        HealthHistory history = new HealthHistory(3, clock);
        for (int i = 1; i <= 5; i++) {
            history.append(HealthSnapshot.builder().overallHealth(i * 10).timestamp(clock.instant()).build());
        }

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.snapshots()).extracting(HealthSnapshot::getOverallHealth).containsExactly(30.0, 40.0, 50.0);
        assertThat(history.recent(2)).extracting(HealthSnapshot::getOverallHealth).containsExactly(40.0, 50.0);
        assertThat(history.latest()).map(HealthSnapshot::getOverallHealth).contains(50.0);
    }

    @Test
    void stampsSnapshotsWithoutTimestamp() {
        HealthHistory history = new HealthHistory(3, clock);

        HealthSnapshot stored = history.append(HealthSnapshot.builder().overallHealth(90).build());

        assertThat(stored.getTimestamp()).isEqualTo(clock.instant());
    }

    @Test
    void readersGetCopies() {
        HealthHistory history = new HealthHistory(3, clock);
        history.append(HealthSnapshot.builder().overallHealth(90).build());

        List<HealthSnapshot> copy = history.snapshots();
        history.append(HealthSnapshot.builder().overallHealth(80).build());

        assertThat(copy).hasSize(1);
        assertThat(history.recent(100)).hasSize(2);
    }

    @Test
    void capacityMustBePositive() {
        assertThatThrownBy(() -> new HealthHistory(0, clock)).isInstanceOf(IllegalArgumentException.class);
    }
}
