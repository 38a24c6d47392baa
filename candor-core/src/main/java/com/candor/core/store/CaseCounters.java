package com.candor.core.store;

/**
 * Incrementally maintained report totals.
 */
public record CaseCounters(long total, long resolved, long dismissed, long refunded) {

    /**
     * Everything neither resolved nor refunded; dismissed reports are included.
     */
    public long pending() {
        return total - resolved - refunded;
    }
}
