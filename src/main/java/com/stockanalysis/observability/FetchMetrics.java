package com.stockanalysis.observability;

import com.stockanalysis.domain.enums.EndpointClass;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for the fetch scheduler, tagged by endpoint class.
 *
 * <ul>
 *   <li><b>fetch.dispatched</b>: calls handed to a worker</li>
 *   <li><b>fetch.succeeded</b>: calls that returned data</li>
 *   <li><b>fetch.deferred</b>: reservations refused because the window was full</li>
 *   <li><b>fetch.rate_limited</b>: calls the broker rejected with a rate-limit response</li>
 *   <li><b>fetch.failed</b>: calls that failed for any other reason</li>
 *   <li><b>fetch.terminal</b>: requests retired after exhausting retries</li>
 *   <li><b>fetch.timed_out</b>: requests abandoned at the batch deadline</li>
 * </ul>
 */
@Component
public class FetchMetrics {

    private final Map<EndpointClass, Counter> dispatched = new EnumMap<>(EndpointClass.class);
    private final Map<EndpointClass, Counter> succeeded = new EnumMap<>(EndpointClass.class);
    private final Map<EndpointClass, Counter> deferred = new EnumMap<>(EndpointClass.class);
    private final Map<EndpointClass, Counter> rateLimited = new EnumMap<>(EndpointClass.class);
    private final Map<EndpointClass, Counter> failed = new EnumMap<>(EndpointClass.class);
    private final Map<EndpointClass, Counter> terminal = new EnumMap<>(EndpointClass.class);
    private final Map<EndpointClass, Counter> timedOut = new EnumMap<>(EndpointClass.class);

    public FetchMetrics(MeterRegistry meterRegistry) {
        for (EndpointClass endpointClass : EndpointClass.values()) {
            dispatched.put(endpointClass, counter(meterRegistry, "fetch.dispatched", "Calls handed to a worker", endpointClass));
            succeeded.put(endpointClass, counter(meterRegistry, "fetch.succeeded", "Calls that returned data", endpointClass));
            deferred.put(endpointClass, counter(meterRegistry, "fetch.deferred", "Reservations refused by a full window", endpointClass));
            rateLimited.put(endpointClass, counter(meterRegistry, "fetch.rate_limited", "Broker rate-limit rejections", endpointClass));
            failed.put(endpointClass, counter(meterRegistry, "fetch.failed", "Calls failed for other reasons", endpointClass));
            terminal.put(endpointClass, counter(meterRegistry, "fetch.terminal", "Requests retired after max retries", endpointClass));
            timedOut.put(endpointClass, counter(meterRegistry, "fetch.timed_out", "Requests abandoned at the deadline", endpointClass));
        }
    }

    public void recordDispatched(EndpointClass endpointClass) {
        dispatched.get(endpointClass).increment();
    }

    public void recordSucceeded(EndpointClass endpointClass) {
        succeeded.get(endpointClass).increment();
    }

    public void recordDeferred(EndpointClass endpointClass) {
        deferred.get(endpointClass).increment();
    }

    public void recordRateLimited(EndpointClass endpointClass) {
        rateLimited.get(endpointClass).increment();
    }

    public void recordFailed(EndpointClass endpointClass) {
        failed.get(endpointClass).increment();
    }

    public void recordTerminal(EndpointClass endpointClass) {
        terminal.get(endpointClass).increment();
    }

    public void recordTimedOut(EndpointClass endpointClass) {
        timedOut.get(endpointClass).increment();
    }

    private static Counter counter(MeterRegistry registry, String name, String description, EndpointClass endpointClass) {
        return Counter.builder(name)
                .description(description)
                .tag("endpoint", endpointClass.name())
                .register(registry);
    }
}
