package com.stockanalysis.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Direction {
    BULLISH(1),
    BEARISH(-1),
    NEUTRAL(0);

    /** +1 for up, -1 for down, 0 for no call. */
    private final int sign;

    public static Direction fromSign(double value) {
        if (value > 0) {
            return BULLISH;
        }
        if (value < 0) {
            return BEARISH;
        }
        return NEUTRAL;
    }
}
