package it.berlink.dbmonitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Combined payload for the monitoring dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringSummary {

    private String status;
    private QueryStats monitoring;
    private PoolMetricsSnapshot pool;
    private HealthScore health;
}
