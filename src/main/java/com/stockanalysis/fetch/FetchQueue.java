package com.stockanalysis.fetch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ready queue of fetch requests ordered by priority level, then by sequence number.
 *
 * <p>Quotes go out before option chains, option chains before historical candles.
 * Within one priority, requests leave in the order they were first enqueued. A request
 * that comes back for a retry keeps its original sequence number.
 *
 * <p>Only the scheduler's coordinating thread touches a queue, so it is not synchronized.
 */
public class FetchQueue {

    private static final Logger log = LoggerFactory.getLogger(FetchQueue.class);

    private static final Comparator<FetchRequest> DISPATCH_ORDER = Comparator.<FetchRequest>comparingInt(
                    r -> r.getPriority().getLevel())
            .thenComparingLong(FetchRequest::getSequenceNumber);

    private final PriorityQueue<FetchRequest> queue = new PriorityQueue<>(DISPATCH_ORDER);
    private final AtomicLong sequenceCounter = new AtomicLong(0);

    public void enqueue(FetchRequest request) {
        if (request.getSequenceNumber() == 0) {
            request.setSequenceNumber(sequenceCounter.incrementAndGet());
        }
        queue.add(request);
        log.debug(
                "Fetch enqueued: id={}, priority={}, retry={}, queueSize={}",
                request.getId(),
                request.getPriority(),
                request.getRetryCount(),
                queue.size());
    }

    /** Next request to try, or null when empty. */
    public FetchRequest poll() {
        return queue.poll();
    }

    public FetchRequest peek() {
        return queue.peek();
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /** Removes and returns everything left, in dispatch order. */
    public List<FetchRequest> drain() {
        List<FetchRequest> drained = new ArrayList<>(queue.size());
        FetchRequest next;
        while ((next = queue.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }
}
