package com.candlegate.core.model;

/**
 * A contiguous run of missing bars between two observed bars.
 */
public record Gap(
    long startTimestamp,  // First missing bar timestamp
    long endTimestamp,    // Last missing bar timestamp
    int missingCount,     // Number of bars in this gap
    boolean filled        // True if gap repair synthesized the missing bars
) {}
