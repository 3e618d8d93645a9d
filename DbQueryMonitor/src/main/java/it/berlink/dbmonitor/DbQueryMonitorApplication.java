package it.berlink.dbmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * DbQueryMonitor - Query instrumentation for connection pools and ORM clients
 *
 * This application wraps database query execution, measures latency,
 * detects slow queries, keeps a bounded in-memory history of executions
 * and exposes aggregated statistics via REST API.
 *
 * Features:
 * - Transparent instrumentation (results and errors pass through unchanged)
 * - Sanitization of credentials in query text and parameters
 * - Micrometer counters, timers and pool gauges
 * - Query pattern analysis and health scoring
 * - Slow-query alerts forwarded to a webhook in production mode
 */
@SpringBootApplication
public class DbQueryMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DbQueryMonitorApplication.class, args);
    }
}
