package it.berlink.dbmonitor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Typed binding for all query.monitor.* configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "query.monitor")
@Data
public class QueryMonitorProperties {

    /** Executions slower than this are counted and logged as slow queries. */
    private long slowQueryThresholdMs = 1000;

    /**
     * Logs every successful, non-slow execution at DEBUG level. The lines only
     * appear when the it.berlink.dbmonitor logger is at DEBUG as well.
     */
    private boolean detailedLogging = false;

    /** Forwards slow-query alerts to the configured alert sink. */
    private boolean productionMode = false;

    /** Capacity of the in-memory execution history. */
    private int maxHistorySize = 1000;

    /** Slow-query alert delivery. */
    private AlertProps alert = new AlertProps();

    @Data
    public static class AlertProps {
        /** Webhook receiving slow-query alerts. Empty = log only. */
        private String webhookUrl = "";
        private int connectTimeoutMs = 2000;
        private int readTimeoutMs = 5000;
    }
}
