package com.stockanalysis.quota;

import java.time.Duration;
import java.time.Instant;

/**
 * Answer to "may I call this endpoint class now?".
 *
 * @param outcome what the caller should do
 * @param waitDuration for {@link Outcome#DEFERRED}, time until the current window ends
 * @param until for {@link Outcome#COOLING_DOWN}, instant the class cooldown lifts
 */
public record QuotaDecision(Outcome outcome, Duration waitDuration, Instant until) {

    public enum Outcome {
        ALLOWED,
        DEFERRED,
        COOLING_DOWN
    }

    private static final QuotaDecision ALLOWED = new QuotaDecision(Outcome.ALLOWED, Duration.ZERO, null);

    public static QuotaDecision allowed() {
        return ALLOWED;
    }

    public static QuotaDecision deferred(Duration waitDuration) {
        return new QuotaDecision(Outcome.DEFERRED, waitDuration, null);
    }

    public static QuotaDecision coolingDown(Instant until) {
        return new QuotaDecision(Outcome.COOLING_DOWN, null, until);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOWED;
    }
}
