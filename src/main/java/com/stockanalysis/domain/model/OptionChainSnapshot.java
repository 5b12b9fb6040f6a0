package com.stockanalysis.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * All option contracts for one underlying captured at one instant, possibly spanning
 * several expiries.
 */
@Value
@Builder
public class OptionChainSnapshot {

    String symbol;

    /** Underlying price at capture time, when the source knows it. */
    BigDecimal spotPrice;

    LocalDateTime capturedAt;

    @Singular
    List<OptionContract> contracts;

    public static OptionChainSnapshot empty(String symbol, LocalDateTime capturedAt) {
        return OptionChainSnapshot.builder().symbol(symbol).capturedAt(capturedAt).build();
    }

    public boolean isEmpty() {
        return contracts.isEmpty();
    }

    /** Distinct expiries in ascending order. */
    public List<LocalDate> expiries() {
        return contracts.stream()
                .map(OptionContract::getExpiry)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    public List<OptionContract> contractsExpiring(LocalDate expiry) {
        return contracts.stream().filter(c -> expiry.equals(c.getExpiry())).collect(Collectors.toList());
    }
}
