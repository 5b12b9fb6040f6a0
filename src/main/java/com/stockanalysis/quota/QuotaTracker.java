package com.stockanalysis.quota;

import com.stockanalysis.domain.enums.EndpointClass;
import com.stockanalysis.exception.InvalidConfigurationException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single source of truth for whether a broker endpoint class may be called right now.
 *
 * <p>Each {@link EndpointClass} owns a fixed-size window aligned to the epoch. A call
 * made exactly on a boundary belongs to the window starting at that instant.
 * {@link #reserve} is an atomic check-and-increment: it only counts the call when it
 * answers {@link QuotaDecision.Outcome#ALLOWED}, so the counter can never pass the
 * configured limit however many threads race on it.
 *
 * <p>When the broker rejects a call anyway ({@link #recordRejection}), the whole class
 * enters a cooldown. Every reservation for that class is refused until the cooldown
 * lifts, which keeps a burst of retries from turning a soft limit into a ban.
 *
 * <p>Each class window is guarded by its own monitor; classes never contend with each
 * other. Time is read from the injected {@link Clock} so tests can drive it.
 */
@Component
public class QuotaTracker {

    private static final Logger log = LoggerFactory.getLogger(QuotaTracker.class);

    private final Clock clock;
    private final long windowMillis;
    private final Duration minRetryDelay;
    private final Map<EndpointClass, ClassWindow> windows = new EnumMap<>(EndpointClass.class);

    public QuotaTracker(QuotaProperties quotaProperties, Clock clock) {
        this.clock = clock;
        Duration window = quotaProperties.getWindow();
        if (window == null || window.isZero() || window.isNegative()) {
            throw new InvalidConfigurationException("analysis.quota.window", window, "must be positive");
        }
        Duration minDelay = quotaProperties.getMinRetryDelay();
        if (minDelay == null || minDelay.isNegative()) {
            throw new InvalidConfigurationException("analysis.quota.min-retry-delay", minDelay, "must not be negative");
        }
        this.windowMillis = window.toMillis();
        this.minRetryDelay = minDelay;

        Map<EndpointClass, Integer> limits = quotaProperties.getLimits();
        for (EndpointClass endpointClass : EndpointClass.values()) {
            Integer limit = limits != null ? limits.get(endpointClass) : null;
            if (limit == null || limit <= 0) {
                throw new InvalidConfigurationException(
                        "analysis.quota.limits." + endpointClass, limit, "every endpoint class needs a positive limit");
            }
            windows.put(endpointClass, new ClassWindow(limit));
        }
        log.info("Quota tracker initialized: window={}ms, minRetryDelay={}, limits={}", windowMillis, minDelay, limits);
    }

    /**
     * Reserves one call for the endpoint class if its budget allows.
     *
     * @return ALLOWED (call counted), DEFERRED with the wait until the window rolls, or
     *     COOLING_DOWN with the instant the class becomes callable again
     */
    public QuotaDecision reserve(EndpointClass endpointClass) {
        ClassWindow window = windows.get(endpointClass);
        synchronized (window) {
            Instant now = clock.instant();
            if (window.cooldownUntil != null) {
                if (now.isBefore(window.cooldownUntil)) {
                    return QuotaDecision.coolingDown(window.cooldownUntil);
                }
                log.info("Cooldown lifted for {}", endpointClass);
                window.cooldownUntil = null;
            }

            rollIfElapsed(window, now);
            if (window.callsMade < window.maxCalls) {
                window.callsMade++;
                return QuotaDecision.allowed();
            }
            Instant windowEnd = Instant.ofEpochMilli(window.windowStartMillis + windowMillis);
            return QuotaDecision.deferred(Duration.between(now, windowEnd));
        }
    }

    /**
     * Records a rate-limit rejection from the broker. Blocks the class until
     * {@code now + max(serverSuggestedDelay, minRetryDelay)} and resets its window counter.
     * A cooldown already running longer is left as is.
     *
     * @param serverSuggestedDelay retry-after from the response, or null when absent
     */
    public void recordRejection(EndpointClass endpointClass, Duration serverSuggestedDelay) {
        ClassWindow window = windows.get(endpointClass);
        synchronized (window) {
            Instant now = clock.instant();
            Duration delay = minRetryDelay;
            if (serverSuggestedDelay != null && serverSuggestedDelay.compareTo(minRetryDelay) > 0) {
                delay = serverSuggestedDelay;
            }
            Instant until = now.plus(delay);
            if (window.cooldownUntil == null || until.isAfter(window.cooldownUntil)) {
                window.cooldownUntil = until;
            }
            window.callsMade = 0;
            window.windowStartMillis = alignedStart(now.toEpochMilli());
            log.warn("Rate limit hit on {}: cooling down until {} (suggested={})",
                    endpointClass, window.cooldownUntil, serverSuggestedDelay);
        }
    }

    public QuotaWindowSnapshot snapshot(EndpointClass endpointClass) {
        ClassWindow window = windows.get(endpointClass);
        synchronized (window) {
            rollIfElapsed(window, clock.instant());
            return new QuotaWindowSnapshot(
                    endpointClass,
                    window.callsMade,
                    window.maxCalls,
                    Instant.ofEpochMilli(window.windowStartMillis),
                    window.cooldownUntil);
        }
    }

    public Instant now() {
        return clock.instant();
    }

    private void rollIfElapsed(ClassWindow window, Instant now) {
        long start = alignedStart(now.toEpochMilli());
        if (start > window.windowStartMillis) {
            window.windowStartMillis = start;
            window.callsMade = 0;
        }
    }

    private long alignedStart(long epochMillis) {
        return Math.floorDiv(epochMillis, windowMillis) * windowMillis;
    }

    /** Mutable per-class state. Only touched while holding the instance monitor. */
    private static final class ClassWindow {

        private final int maxCalls;
        private int callsMade;
        private long windowStartMillis = Long.MIN_VALUE;
        private Instant cooldownUntil;

        private ClassWindow(int maxCalls) {
            this.maxCalls = maxCalls;
        }
    }
}
