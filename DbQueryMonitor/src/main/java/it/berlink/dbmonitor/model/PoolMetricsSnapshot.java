package it.berlink.dbmonitor.model;

import lombok.Value;

/**
 * Connection counts reported by the pool on connect/remove events.
 */
@Value
public class PoolMetricsSnapshot {

    public static final PoolMetricsSnapshot EMPTY = new PoolMetricsSnapshot(0, 0, 0);

    int active;
    int idle;
    int total;
}
