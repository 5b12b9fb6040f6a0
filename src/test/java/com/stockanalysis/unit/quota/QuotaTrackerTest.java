package com.stockanalysis.unit.quota;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.stockanalysis.domain.enums.EndpointClass;
import com.stockanalysis.exception.InvalidConfigurationException;
import com.stockanalysis.quota.QuotaDecision;
import com.stockanalysis.quota.QuotaProperties;
import com.stockanalysis.quota.QuotaTracker;
import com.stockanalysis.quota.QuotaWindowSnapshot;
import com.stockanalysis.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QuotaTrackerTest {

    /** Minute-aligned so window boundaries fall on whole minutes from here. */
    private static final Instant START = Instant.parse("2026-01-05T04:00:00Z");

    private MutableClock clock;
    private QuotaProperties quotaProperties;
    private QuotaTracker quotaTracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        quotaProperties = new QuotaProperties();
        quotaProperties.getLimits().put(EndpointClass.HISTORICAL, 3);
        quotaTracker = new QuotaTracker(quotaProperties, clock);
    }

    @Nested
    @DisplayName("Window budget")
    class WindowBudget {

        @Test
        @DisplayName("Allows calls up to the limit, then defers until the window ends")
        void defersOnceLimitReached() {
            for (int i = 0; i < 3; i++) {
                assertThat(quotaTracker.reserve(EndpointClass.HISTORICAL).isAllowed()).isTrue();
            }

            clock.advance(Duration.ofSeconds(20));
            QuotaDecision decision = quotaTracker.reserve(EndpointClass.HISTORICAL);

            assertThat(decision.outcome()).isEqualTo(QuotaDecision.Outcome.DEFERRED);
            assertThat(decision.waitDuration()).isEqualTo(Duration.ofSeconds(40));
        }

        @Test
        @DisplayName("A refused reservation does not count against the window")
        void refusalIsNotCounted() {
            for (int i = 0; i < 10; i++) {
                quotaTracker.reserve(EndpointClass.HISTORICAL);
            }

            QuotaWindowSnapshot snapshot = quotaTracker.snapshot(EndpointClass.HISTORICAL);
            assertThat(snapshot.callsMade()).isEqualTo(3);
            assertThat(snapshot.maxCalls()).isEqualTo(3);
        }

        @Test
        @DisplayName("A call exactly on the boundary belongs to the new window")
        void boundaryStartsNewWindow() {
            for (int i = 0; i < 3; i++) {
                quotaTracker.reserve(EndpointClass.HISTORICAL);
            }
            clock.advance(Duration.ofSeconds(59).plusMillis(999));
            assertThat(quotaTracker.reserve(EndpointClass.HISTORICAL).isAllowed()).isFalse();

            clock.advance(Duration.ofMillis(1));
            assertThat(quotaTracker.reserve(EndpointClass.HISTORICAL).isAllowed()).isTrue();
            assertThat(quotaTracker.snapshot(EndpointClass.HISTORICAL).windowStart()).isEqualTo(START.plusSeconds(60));
        }

        @Test
        @DisplayName("Endpoint classes have independent budgets")
        void classesAreIndependent() {
            for (int i = 0; i < 3; i++) {
                quotaTracker.reserve(EndpointClass.HISTORICAL);
            }

            assertThat(quotaTracker.reserve(EndpointClass.HISTORICAL).isAllowed()).isFalse();
            assertThat(quotaTracker.reserve(EndpointClass.QUOTE).isAllowed()).isTrue();
            assertThat(quotaTracker.reserve(EndpointClass.OPTION_CHAIN).isAllowed()).isTrue();
        }

        @Test
        @DisplayName("A clock stepping backwards does not reset the count")
        void backwardsClockKeepsCount() {
            clock.advance(Duration.ofSeconds(30));
            for (int i = 0; i < 3; i++) {
                quotaTracker.reserve(EndpointClass.HISTORICAL);
            }

            clock.set(START.minusSeconds(30));

            assertThat(quotaTracker.reserve(EndpointClass.HISTORICAL).isAllowed()).isFalse();
        }
    }

    @Nested
    @DisplayName("Concurrent reservations")
    class Concurrency {

        @Test
        @DisplayName("Many threads racing on one class never exceed the limit")
        void neverExceedsLimit() throws Exception {
            quotaProperties.getLimits().put(EndpointClass.QUOTE, 60);
            QuotaTracker tracker = new QuotaTracker(quotaProperties, clock);
            ExecutorService pool = Executors.newFixedThreadPool(16);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger allowed = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < 16; t++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < 100; i++) {
                            if (tracker.reserve(EndpointClass.QUOTE).isAllowed()) {
                                allowed.incrementAndGet();
                            }
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(allowed.get()).isEqualTo(60);
            assertThat(tracker.snapshot(EndpointClass.QUOTE).callsMade()).isEqualTo(60);
        }
    }

    @Nested
    @DisplayName("Rate-limit cooldown")
    class Cooldown {

        @Test
        @DisplayName("A rejection blocks the class for at least the minimum retry delay")
        void rejectionStartsCooldown() {
            quotaTracker.reserve(EndpointClass.HISTORICAL);
            quotaTracker.recordRejection(EndpointClass.HISTORICAL, null);

            QuotaDecision decision = quotaTracker.reserve(EndpointClass.HISTORICAL);
            assertThat(decision.outcome()).isEqualTo(QuotaDecision.Outcome.COOLING_DOWN);
            assertThat(decision.until()).isEqualTo(START.plusSeconds(60));

            clock.advance(Duration.ofSeconds(59));
            assertThat(quotaTracker.reserve(EndpointClass.HISTORICAL).isAllowed()).isFalse();

            clock.advance(Duration.ofSeconds(1));
            assertThat(quotaTracker.reserve(EndpointClass.HISTORICAL).isAllowed()).isTrue();
        }

        @Test
        @DisplayName("A longer server-suggested delay is honoured")
        void serverDelayHonoured() {
            quotaTracker.recordRejection(EndpointClass.HISTORICAL, Duration.ofSeconds(150));

            assertThat(quotaTracker.reserve(EndpointClass.HISTORICAL).until()).isEqualTo(START.plusSeconds(150));
        }

        @Test
        @DisplayName("A shorter server-suggested delay is raised to the minimum")
        void shortServerDelayRaised() {
            quotaTracker.recordRejection(EndpointClass.HISTORICAL, Duration.ofSeconds(5));

            assertThat(quotaTracker.reserve(EndpointClass.HISTORICAL).until()).isEqualTo(START.plusSeconds(60));
        }

        @Test
        @DisplayName("A later rejection never shortens a running cooldown")
        void cooldownNeverShortened() {
            quotaTracker.recordRejection(EndpointClass.HISTORICAL, Duration.ofMinutes(5));
            clock.advance(Duration.ofSeconds(10));
            quotaTracker.recordRejection(EndpointClass.HISTORICAL, null);

            assertThat(quotaTracker.snapshot(EndpointClass.HISTORICAL).cooldownUntil())
                    .isEqualTo(START.plus(Duration.ofMinutes(5)));
        }

        @Test
        @DisplayName("Cooldown on one class leaves the others callable")
        void cooldownIsPerClass() {
            quotaTracker.recordRejection(EndpointClass.HISTORICAL, null);

            assertThat(quotaTracker.reserve(EndpointClass.QUOTE).isAllowed()).isTrue();
        }
    }

    @Nested
    @DisplayName("Configuration validation")
    class Validation {

        @Test
        @DisplayName("Zero window is rejected")
        void zeroWindowRejected() {
            quotaProperties.setWindow(Duration.ZERO);

            assertThatThrownBy(() -> new QuotaTracker(quotaProperties, clock))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("analysis.quota.window");
        }

        @Test
        @DisplayName("A class without a positive limit is rejected")
        void missingLimitRejected() {
            quotaProperties.getLimits().remove(EndpointClass.ORDER);

            assertThatThrownBy(() -> new QuotaTracker(quotaProperties, clock))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("ORDER");
            assertThat(quotaProperties.isLimitsComplete()).isFalse();
        }

        @Test
        @DisplayName("Negative limit is rejected")
        void negativeLimitRejected() {
            quotaProperties.getLimits().put(EndpointClass.QUOTE, -1);

            assertThatThrownBy(() -> new QuotaTracker(quotaProperties, clock))
                    .isInstanceOf(InvalidConfigurationException.class);
        }
    }
}
