package com.example.quotemonitor.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Direction of a quote change between two consecutive observations,
 * with the wording used in its notification message.
 */
@Getter
@RequiredArgsConstructor
public enum PriceMovement {
    UNCHANGED("não mudou", ":|"),
    INCREASED("subiu", ":)"),
    DECREASED("caiu", ":(");

    private final String verb;
    private final String symbol;

    /**
     * Classify with exact equality: only identical values count as unchanged.
     */
    public static PriceMovement classify(double previous, double current) {
        if (current == previous) {
            return UNCHANGED;
        }
        return current > previous ? INCREASED : DECREASED;
    }

    public boolean isChange() {
        return this != UNCHANGED;
    }
}
