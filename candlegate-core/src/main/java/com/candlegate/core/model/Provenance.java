package com.candlegate.core.model;

/**
 * Where a bar's values came from.
 */
public enum Provenance {
    /** As returned by the exchange. */
    OBSERVED,
    /** Observed timestamp, one or more missing fields carried forward from the previous bar. */
    IMPUTED,
    /** Row created by gap repair for a missing interval. */
    SYNTHESIZED
}
