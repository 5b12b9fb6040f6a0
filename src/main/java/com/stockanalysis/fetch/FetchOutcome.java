package com.stockanalysis.fetch;

import com.stockanalysis.domain.enums.FetchStatus;
import com.stockanalysis.domain.enums.MarketDataType;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/** Final result of one fetch request within a cycle. Exactly one exists per request. */
@Value
@Builder
public class FetchOutcome {

    String requestId;
    String symbol;
    MarketDataType dataType;
    FetchStatus status;

    /** The fetched value for {@link FetchStatus#SUCCEEDED}, otherwise null. */
    Object payload;

    int attempts;

    /** Last error message for failed or abandoned requests. */
    String failureReason;

    public boolean isSucceeded() {
        return status == FetchStatus.SUCCEEDED;
    }

    public <T> Optional<T> payloadAs(Class<T> type) {
        return type.isInstance(payload) ? Optional.of(type.cast(payload)) : Optional.empty();
    }

    static FetchOutcome succeeded(FetchRequest request, Object payload) {
        return of(request, FetchStatus.SUCCEEDED, payload, null);
    }

    static FetchOutcome unavailable(FetchRequest request, String reason) {
        return of(request, FetchStatus.UNAVAILABLE, null, reason);
    }

    static FetchOutcome timedOut(FetchRequest request) {
        return of(request, FetchStatus.TIMED_OUT, null, "Batch deadline passed");
    }

    private static FetchOutcome of(FetchRequest request, FetchStatus status, Object payload, String reason) {
        return FetchOutcome.builder()
                .requestId(request.getId())
                .symbol(request.getSymbol())
                .dataType(request.getDataType())
                .status(status)
                .payload(payload)
                .attempts(request.getAttempts())
                .failureReason(reason)
                .build();
    }
}
