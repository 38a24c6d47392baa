package com.candor.core.domain;

/**
 * Clear values returned by the oracle for one report.
 */
public record RevealedValues(int category, int severity, long timestamp) {

    public static final RevealedValues NONE = new RevealedValues(0, 0, 0L);
}
