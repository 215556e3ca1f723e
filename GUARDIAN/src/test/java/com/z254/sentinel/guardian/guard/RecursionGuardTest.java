package com.z254.sentinel.guardian.guard;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecursionGuardTest {

    @Test
    void rejectsSessionsBeyondCapacity() {
        RecursionGuard guard = new RecursionGuard(2);

        Optional<RecursionGuard.Session> first = guard.tryAcquire("/work");
        Optional<RecursionGuard.Session> second = guard.tryAcquire("/work");
        Optional<RecursionGuard.Session> third = guard.tryAcquire("/work");

        assertThat(first).isPresent();
        assertThat(second).isPresent();
        assertThat(third).isEmpty();
        assertThat(guard.getActiveSessions()).isEqualTo(2);
        assertThat(guard.isAtCapacity()).isTrue();
    }

    @Test
    void closingReleasesSlotOnce() {
        RecursionGuard guard = new RecursionGuard(1);
        RecursionGuard.Session session = guard.tryAcquire("/work").orElseThrow();

        session.close();
        session.close();

        assertThat(guard.getActiveSessions()).isZero();
        assertThat(guard.getActiveSessionIds()).isEmpty();
        assertThat(guard.tryAcquire("/work")).isPresent();
    }

    @Test
    void sessionIdsAreUnique() {
        RecursionGuard guard = new RecursionGuard(3);

        String a = guard.tryAcquire("/work").orElseThrow().getId();
        String b = guard.tryAcquire("/work").orElseThrow().getId();

        assertThat(a).isNotEqualTo(b).startsWith("/work-");
        assertThat(guard.getActiveSessionIds()).containsExactlyInAnyOrder(a, b);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new RecursionGuard(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void neverExceedsCapacityUnderContention() throws InterruptedException {
        RecursionGuard guard = new RecursionGuard(3);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger maxObserved = new AtomicInteger();
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            tasks.add(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                guard.tryAcquire("/work").ifPresent(session -> {
                    maxObserved.accumulateAndGet(guard.getActiveSessions(), Math::max);
                    session.close();
                });
            });
        }
        tasks.forEach(executor::submit);
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(maxObserved.get()).isLessThanOrEqualTo(3);
        assertThat(guard.getActiveSessions()).isZero();
    }
}
