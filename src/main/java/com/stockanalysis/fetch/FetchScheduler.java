package com.stockanalysis.fetch;

import com.stockanalysis.domain.enums.EndpointClass;
import com.stockanalysis.exception.BaseException;
import com.stockanalysis.exception.RateLimitException;
import com.stockanalysis.marketdata.MarketDataSource;
import com.stockanalysis.observability.FetchMetrics;
import com.stockanalysis.quota.QuotaDecision;
import com.stockanalysis.quota.QuotaTracker;
import io.github.resilience4j.core.IntervalFunction;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns a batch of {@link FetchRequest}s into {@link FetchOutcome}s without breaking any
 * endpoint class quota.
 *
 * <p>One coordinating thread (the caller of {@link #execute}) owns all scheduling state:
 * the ready queue, requests parked on a full window, requests parked on a class cooldown,
 * and the set of in-flight calls. Quota is reserved on that thread before a request is
 * handed to the worker pool, so a worker never starts a call the tracker has not
 * approved, and no more than {@code workerPoolSize} calls are ever in flight. Workers
 * report back through a completion queue and never touch scheduling state.
 *
 * <p>Per request lifecycle:
 * <ol>
 *   <li>ALLOWED: dispatched. Success retires the request. A rate-limit response puts the
 *       endpoint class into cooldown and re-queues the request; any other error parks it
 *       for an exponential backoff. Both count as a retry.</li>
 *   <li>DEFERRED: parked until the current window ends, not holding a worker.</li>
 *   <li>COOLING_DOWN: parked with every other request of its class until the cooldown lifts.</li>
 * </ol>
 * A request whose retry count passes {@code maxRetries} is reported {@code UNAVAILABLE}
 * once and dropped. When the deadline passes, every unfinished request is reported
 * {@code TIMED_OUT} and in-flight calls are cancelled; their late results are ignored.
 */
@Service
public class FetchScheduler {

    private static final Logger log = LoggerFactory.getLogger(FetchScheduler.class);

    private final QuotaTracker quotaTracker;
    private final MarketDataSource marketDataSource;
    private final ExecutorService workerPool;
    private final FetchSchedulerConfig config;
    private final CompletionWaiter completionWaiter;
    private final Clock clock;
    private final FetchMetrics fetchMetrics;
    private final IntervalFunction backoff;

    public FetchScheduler(
            QuotaTracker quotaTracker,
            MarketDataSource marketDataSource,
            @Qualifier("fetchWorkerPool") ExecutorService workerPool,
            FetchSchedulerConfig config,
            CompletionWaiter completionWaiter,
            Clock clock,
            FetchMetrics fetchMetrics) {
        this.quotaTracker = quotaTracker;
        this.marketDataSource = marketDataSource;
        this.workerPool = workerPool;
        this.config = config;
        this.completionWaiter = completionWaiter;
        this.clock = clock;
        this.fetchMetrics = fetchMetrics;
        this.backoff = IntervalFunction.ofExponentialBackoff(
                config.getRetryBackoffFloor().toMillis(),
                config.getBackoffMultiplier(),
                config.getMaxBackoff().toMillis());
    }

    /**
     * Runs every request to an outcome or until the deadline, whichever comes first.
     * Blocks the calling thread for the duration.
     *
     * @param deadline absolute instant after which nothing new is dispatched; an instant
     *     that has already passed dispatches nothing
     */
    public FetchBatchResult execute(Collection<FetchRequest> requests, Instant deadline) {
        log.info(
                "Fetch batch starting: requests={}, workers={}, deadline={}",
                requests.size(),
                config.getWorkerPoolSize(),
                deadline);
        Cycle cycle = new Cycle(requests, deadline);
        cycle.run();
        FetchBatchResult result = cycle.result();
        log.info(
                "Fetch batch finished: {} (rateLimited={}, transientFailures={})",
                result.countsByStatus(),
                result.getRateLimitRejections(),
                result.getTransientFailures());
        return result;
    }

    private Object fetch(FetchRequest request) {
        return switch (request.getDataType()) {
            case HISTORICAL -> marketDataSource.fetchHistorical(request.getSymbol(), request.getRange());
            case QUOTE -> marketDataSource.fetchQuote(request.getSymbol());
            case OPTION_CHAIN -> marketDataSource.fetchOptionChain(request.getSymbol());
        };
    }

    private static boolean isRetryable(Throwable error) {
        if (error instanceof Error) {
            return false;
        }
        if (error instanceof BaseException) {
            return ((BaseException) error).getErrorCode().isRetryable();
        }
        return true;
    }

    /** Result message handed from a worker back to the coordinator. */
    private record Completion(FetchRequest request, Object payload, Throwable error) {}

    private record ParkedRequest(Instant wakeAt, FetchRequest request) {}

    /** Scheduling state for one {@link #execute} call. Confined to the coordinating thread. */
    private final class Cycle {

        private final List<FetchRequest> submitted;
        private final Instant deadline;
        private final FetchQueue ready = new FetchQueue();
        private final PriorityQueue<ParkedRequest> parked = new PriorityQueue<>(Comparator.comparing(
                        ParkedRequest::wakeAt)
                .thenComparingLong(p -> p.request().getSequenceNumber()));
        private final Map<EndpointClass, Instant> classCooldowns = new EnumMap<>(EndpointClass.class);
        private final Map<EndpointClass, List<FetchRequest>> coolingRequests = new EnumMap<>(EndpointClass.class);
        private final Map<String, Future<?>> inFlight = new HashMap<>();
        private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        private final Map<String, FetchOutcome> outcomes = new HashMap<>();
        private int rateLimitRejections;
        private int transientFailures;

        private Cycle(Collection<FetchRequest> requests, Instant deadline) {
            this.submitted = new ArrayList<>(requests);
            this.deadline = deadline;
            submitted.forEach(ready::enqueue);
        }

        private void run() {
            try {
                while (true) {
                    Completion completion;
                    while ((completion = completions.poll()) != null) {
                        handle(completion);
                    }

                    Instant now = clock.instant();
                    if (!now.isBefore(deadline)) {
                        abandonAll();
                        return;
                    }

                    releaseDue(now);
                    dispatchReady(now);

                    if (isIdle()) {
                        return;
                    }

                    Completion next = completionWaiter.await(completions, nextWakeUp(), !inFlight.isEmpty());
                    if (next != null) {
                        handle(next);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Fetch batch interrupted, abandoning {} unfinished requests", submitted.size() - outcomes.size());
                abandonAll();
            }
        }

        private void dispatchReady(Instant now) {
            while (inFlight.size() < config.getWorkerPoolSize() && !ready.isEmpty()) {
                FetchRequest request = ready.poll();
                EndpointClass endpointClass = request.getEndpointClass();
                QuotaDecision decision = quotaTracker.reserve(endpointClass);
                switch (decision.outcome()) {
                    case ALLOWED -> dispatch(request, now);
                    case DEFERRED -> {
                        fetchMetrics.recordDeferred(endpointClass);
                        parked.add(new ParkedRequest(now.plus(decision.waitDuration()), request));
                        log.debug("Deferred {} for {}", request.getId(), decision.waitDuration());
                    }
                    case COOLING_DOWN -> {
                        coolingRequests
                                .computeIfAbsent(endpointClass, k -> new ArrayList<>())
                                .add(request);
                        classCooldowns.merge(endpointClass, decision.until(), (a, b) -> a.isAfter(b) ? a : b);
                    }
                }
            }
        }

        private void dispatch(FetchRequest request, Instant now) {
            request.setLastAttemptAt(now);
            request.setAttempts(request.getAttempts() + 1);
            fetchMetrics.recordDispatched(request.getEndpointClass());
            try {
                Future<?> future = workerPool.submit(() -> {
                    Completion completion;
                    try {
                        completion = new Completion(request, fetch(request), null);
                    } catch (Throwable t) {
                        completion = new Completion(request, null, t);
                    }
                    completions.add(completion);
                });
                inFlight.put(request.getId(), future);
                log.debug("Dispatched {} (attempt {})", request.getId(), request.getAttempts());
            } catch (RejectedExecutionException e) {
                log.error("Worker pool rejected {}", request.getId(), e);
                completions.add(new Completion(request, null, e));
            }
        }

        private void handle(Completion completion) {
            FetchRequest request = completion.request();
            inFlight.remove(request.getId());
            if (outcomes.containsKey(request.getId())) {
                return;
            }
            EndpointClass endpointClass = request.getEndpointClass();
            Throwable error = completion.error();

            if (error == null) {
                fetchMetrics.recordSucceeded(endpointClass);
                outcomes.put(request.getId(), FetchOutcome.succeeded(request, completion.payload()));
                return;
            }

            request.setRetryCount(request.getRetryCount() + 1);
            if (error instanceof RateLimitException) {
                rateLimitRejections++;
                fetchMetrics.recordRateLimited(endpointClass);
                quotaTracker.recordRejection(
                        endpointClass, ((RateLimitException) error).getRetryAfter().orElse(null));
                if (retryAllowed(request, error)) {
                    ready.enqueue(request);
                }
                return;
            }

            transientFailures++;
            fetchMetrics.recordFailed(endpointClass);
            if (!isRetryable(error)) {
                retire(request, error);
                return;
            }
            if (retryAllowed(request, error)) {
                Duration wait = Duration.ofMillis(backoff.apply(request.getRetryCount()));
                log.info(
                        "Fetch {} failed (retry {}/{}), backing off {}: {}",
                        request.getId(),
                        request.getRetryCount(),
                        config.getMaxRetries(),
                        wait,
                        error.getMessage());
                parked.add(new ParkedRequest(clock.instant().plus(wait), request));
            }
        }

        private boolean retryAllowed(FetchRequest request, Throwable error) {
            if (request.getRetryCount() > config.getMaxRetries()) {
                retire(request, error);
                return false;
            }
            return true;
        }

        private void retire(FetchRequest request, Throwable error) {
            fetchMetrics.recordTerminal(request.getEndpointClass());
            String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            outcomes.put(request.getId(), FetchOutcome.unavailable(request, reason));
            log.warn(
                    "Fetch {} unavailable after {} attempts: {}",
                    request.getId(),
                    request.getAttempts(),
                    error.getMessage());
        }

        private void releaseDue(Instant now) {
            while (!parked.isEmpty() && !parked.peek().wakeAt().isAfter(now)) {
                ready.enqueue(parked.poll().request());
            }
            Iterator<Map.Entry<EndpointClass, Instant>> it = classCooldowns.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<EndpointClass, Instant> cooldown = it.next();
                if (!cooldown.getValue().isAfter(now)) {
                    List<FetchRequest> released = coolingRequests.remove(cooldown.getKey());
                    if (released != null) {
                        released.forEach(ready::enqueue);
                    }
                    it.remove();
                }
            }
        }

        private Instant nextWakeUp() {
            Instant wakeAt = deadline;
            if (!parked.isEmpty() && parked.peek().wakeAt().isBefore(wakeAt)) {
                wakeAt = parked.peek().wakeAt();
            }
            for (Instant until : classCooldowns.values()) {
                if (until.isBefore(wakeAt)) {
                    wakeAt = until;
                }
            }
            return wakeAt;
        }

        private boolean isIdle() {
            return ready.isEmpty() && inFlight.isEmpty() && parked.isEmpty() && coolingRequests.isEmpty();
        }

        private void abandonAll() {
            for (FetchRequest request : submitted) {
                if (!outcomes.containsKey(request.getId())) {
                    fetchMetrics.recordTimedOut(request.getEndpointClass());
                    outcomes.put(request.getId(), FetchOutcome.timedOut(request));
                }
            }
            inFlight.values().forEach(future -> future.cancel(true));
            if (!inFlight.isEmpty()) {
                log.warn("Deadline passed with {} calls in flight; cancelled", inFlight.size());
            }
            inFlight.clear();
            ready.drain();
            parked.clear();
            coolingRequests.clear();
            classCooldowns.clear();
        }

        private FetchBatchResult result() {
            Map<String, FetchOutcome> ordered = new LinkedHashMap<>();
            for (FetchRequest request : submitted) {
                ordered.put(request.getId(), outcomes.get(request.getId()));
            }
            return new FetchBatchResult(new ArrayList<>(ordered.values()), rateLimitRejections, transientFailures);
        }
    }
}
