package it.berlink.dbmonitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response of the health endpoint: score, tier and advice for the current stats.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthReport {

    private int score;
    private HealthStatus status;
    private List<String> recommendations;
    private QueryStats stats;
    private Instant generatedAt;
}
