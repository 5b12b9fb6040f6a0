package com.stockanalysis.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Dispatch priority for fetch requests. Lower level = dispatched first.
 * Within the same level requests leave the queue in submission order.
 */
@Getter
@RequiredArgsConstructor
public enum FetchPriority {
    HIGH(1, "Live prices that go stale within seconds"),
    MEDIUM(2, "Option chain snapshots"),
    LOW(3, "Historical candles");

    private final int level;
    private final String description;
}
