package com.stockanalysis.fetch;

import java.time.Instant;
import java.util.concurrent.BlockingQueue;

/**
 * How the scheduler's coordinating thread waits for the next event: a worker finishing,
 * a parked request becoming due, or the deadline. Keeping the wait behind this seam lets
 * tests advance a virtual clock instead of sleeping.
 */
public interface CompletionWaiter {

    /**
     * Waits for the next completion, but no later than {@code wakeAt}.
     *
     * @param workInFlight whether any fetch is currently running and could complete
     * @return the completion that arrived, or null when {@code wakeAt} was reached first
     */
    <T> T await(BlockingQueue<T> completions, Instant wakeAt, boolean workInFlight) throws InterruptedException;
}
