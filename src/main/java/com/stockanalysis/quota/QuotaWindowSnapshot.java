package com.stockanalysis.quota;

import com.stockanalysis.domain.enums.EndpointClass;
import java.time.Instant;

/** Point-in-time copy of one endpoint class's quota state. */
public record QuotaWindowSnapshot(
        EndpointClass endpointClass, int callsMade, int maxCalls, Instant windowStart, Instant cooldownUntil) {

    public boolean isCoolingDown(Instant now) {
        return cooldownUntil != null && now.isBefore(cooldownUntil);
    }
}
