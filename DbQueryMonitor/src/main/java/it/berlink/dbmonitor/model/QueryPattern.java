package it.berlink.dbmonitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated metrics for a normalized query shape.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryPattern {

    private String pattern;
    private String patternHash;
    private long count;
    private double totalDurationMs;
    private double avgDurationMs;
}
