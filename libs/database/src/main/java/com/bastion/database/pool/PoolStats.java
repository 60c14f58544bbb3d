package com.bastion.database.pool;

/**
 * Point-in-time pool occupancy.
 *
 * @param active connections checked out
 * @param idle connections ready for checkout
 * @param total open connections
 * @param waiting threads blocked in checkout
 */
public record PoolStats(int active, int idle, int total, int waiting) {

    /** Stats of a pool that has not opened any connection yet. */
    public static PoolStats notStarted() {
        return new PoolStats(0, 0, 0, 0);
    }
}
