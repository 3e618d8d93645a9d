package it.berlink.dbmonitor.controller;

import it.berlink.dbmonitor.health.HealthScorer;
import it.berlink.dbmonitor.model.HealthReport;
import it.berlink.dbmonitor.model.MeterSnapshot;
import it.berlink.dbmonitor.model.MonitoringSummary;
import it.berlink.dbmonitor.model.QueryPattern;
import it.berlink.dbmonitor.model.QueryStats;
import it.berlink.dbmonitor.service.QueryMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for database query monitoring.
 */
@RestController
@RequiredArgsConstructor
public class DatabaseMonitorController {

    private final QueryMonitor queryMonitor;
    private final HealthScorer healthScorer;

    /**
     * Returns statistics over the in-memory execution history.
     */
    @GetMapping("/db-stats")
    public ResponseEntity<QueryStats> getStats() {
        return ResponseEntity.ok(queryMonitor.getQueryStats());
    }

    /**
     * Returns the current value of every registered meter.
     */
    @GetMapping("/db-metrics")
    public ResponseEntity<List<MeterSnapshot>> getMetrics() {
        return ResponseEntity.ok(queryMonitor.getRealTimeMetrics());
    }

    /**
     * Returns the most frequent query patterns.
     */
    @GetMapping("/db-patterns")
    public ResponseEntity<List<QueryPattern>> getPatterns() {
        return ResponseEntity.ok(queryMonitor.analyzeQueryPatterns());
    }

    /**
     * Returns the health score, status and recommendations.
     */
    @GetMapping("/db-health")
    public ResponseEntity<HealthReport> getHealth() {
        QueryStats stats = queryMonitor.getQueryStats();
        List<QueryPattern> patterns = queryMonitor.analyzeQueryPatterns();
        return ResponseEntity.ok(healthScorer.evaluate(stats, patterns));
    }

    /**
     * Returns stats, pool gauges and health in one payload for the dashboard.
     */
    @GetMapping("/db-monitoring")
    public ResponseEntity<MonitoringSummary> getMonitoring() {
        QueryStats stats = queryMonitor.getQueryStats();
        return ResponseEntity.ok(MonitoringSummary.builder()
            .status("ok")
            .monitoring(stats)
            .pool(queryMonitor.getPoolMetrics())
            .health(healthScorer.score(stats))
            .build());
    }
}
