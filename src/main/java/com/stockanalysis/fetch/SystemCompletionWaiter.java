package com.stockanalysis.fetch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/** Wall-clock waiter: a timed poll on the completion queue. */
@Component
public class SystemCompletionWaiter implements CompletionWaiter {

    /** Upper bound on a single wait so a far deadline never turns into one huge poll. */
    private static final long MAX_WAIT_MILLIS = 60_000;

    private final Clock clock;

    public SystemCompletionWaiter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public <T> T await(BlockingQueue<T> completions, Instant wakeAt, boolean workInFlight)
            throws InterruptedException {
        long millis = Duration.between(clock.instant(), wakeAt).toMillis();
        if (millis <= 0) {
            return completions.poll();
        }
        return completions.poll(Math.min(millis, MAX_WAIT_MILLIS), TimeUnit.MILLISECONDS);
    }
}
