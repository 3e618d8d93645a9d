package it.berlink.dbmonitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Statistics computed over the execution history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryStats {

    private long total;
    private long errors;
    private long last5Minutes;
    private long lastHour;
    private long slowQueries;
    private long slowQueryThresholdMs;
    private AverageDuration averageDuration;
    private List<SlowQuerySummary> topSlowQueries;
}
