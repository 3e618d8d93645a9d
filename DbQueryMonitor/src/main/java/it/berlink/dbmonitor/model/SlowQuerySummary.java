package it.berlink.dbmonitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entry of the slowest-queries list in {@link QueryStats}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlowQuerySummary {

    private String query;
    private double durationMs;
    private Instant timestamp;
}
