package it.berlink.dbmonitor.service;

import it.berlink.dbmonitor.alert.SlowQueryAlertSink;
import it.berlink.dbmonitor.config.QueryMonitorProperties;
import it.berlink.dbmonitor.model.AverageDuration;
import it.berlink.dbmonitor.model.MeterSnapshot;
import it.berlink.dbmonitor.model.PoolMetricsSnapshot;
import it.berlink.dbmonitor.model.QueryContext;
import it.berlink.dbmonitor.model.QueryPattern;
import it.berlink.dbmonitor.model.QueryRecord;
import it.berlink.dbmonitor.model.QueryStats;
import it.berlink.dbmonitor.model.SlowQuerySummary;
import it.berlink.dbmonitor.pattern.QueryPatternAnalyzer;
import it.berlink.dbmonitor.sanitizer.QuerySanitizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Measures query executions, keeps the bounded execution history and computes
 * the statistics served by the monitoring endpoints.
 *
 * One instance is shared by the pool and ORM adapters. The wrapped call runs
 * without any lock; only the bookkeeping after it completes touches shared state.
 */
@Slf4j
@Service
public class QueryMonitor {

    static final String QUERIES_METRIC = "db.queries";
    static final String DURATION_METRIC = "db.query.duration";
    static final String SLOW_QUERIES_METRIC = "db.slow.queries";
    static final String POOL_SIZE_METRIC = "db.connection.pool.size";

    static final String STATUS_SUCCESS = "success";
    static final String STATUS_ERROR = "error";

    private static final Duration[] DURATION_BUCKETS = {
        Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofMillis(10), Duration.ofMillis(50),
        Duration.ofMillis(100), Duration.ofMillis(500), Duration.ofSeconds(1), Duration.ofSeconds(2),
        Duration.ofSeconds(5), Duration.ofSeconds(10)
    };

    private static final Duration LAST_5_MINUTES = Duration.ofMinutes(5);
    private static final Duration LAST_HOUR = Duration.ofHours(1);
    private static final int TOP_SLOW_QUERIES = 10;
    private static final int SLOW_QUERY_TEXT_LENGTH = 100;

    private final MeterRegistry meterRegistry;
    private final QueryMonitorProperties properties;
    private final QuerySanitizer sanitizer;
    private final QueryPatternAnalyzer patternAnalyzer;
    private final SlowQueryAlertSink alertSink;
    private final Clock clock;
    private final QueryHistory history;

    private final AtomicInteger activeConnections = new AtomicInteger();
    private final AtomicInteger idleConnections = new AtomicInteger();
    private final AtomicInteger totalConnections = new AtomicInteger();
    private volatile PoolMetricsSnapshot poolMetrics = PoolMetricsSnapshot.EMPTY;

    public QueryMonitor(
            MeterRegistry meterRegistry,
            QueryMonitorProperties properties,
            QuerySanitizer sanitizer,
            QueryPatternAnalyzer patternAnalyzer,
            SlowQueryAlertSink alertSink,
            Clock clock) {
        this.meterRegistry = meterRegistry;
        this.properties = properties;
        this.sanitizer = sanitizer;
        this.patternAnalyzer = patternAnalyzer;
        this.alertSink = alertSink;
        this.clock = clock;
        this.history = new QueryHistory(properties.getMaxHistorySize());

        registerPoolGauge("active", activeConnections);
        registerPoolGauge("idle", idleConnections);
        registerPoolGauge("total", totalConnections);

        log.info("QueryMonitor initialised: slowQueryThreshold={}ms, maxHistorySize={}, detailedLogging={}, productionMode={}",
            properties.getSlowQueryThresholdMs(), properties.getMaxHistorySize(),
            properties.isDetailedLogging(), properties.isProductionMode());
    }

    private void registerPoolGauge(String status, AtomicInteger value) {
        Gauge.builder(POOL_SIZE_METRIC, value, AtomicInteger::get)
            .description("Current database connection pool size")
            .tag("status", status)
            .register(meterRegistry);
    }

    /**
     * Runs the execution and records it.
     *
     * Returns exactly what the execution returns and throws exactly the
     * exception instance it throws. One record is appended to the history
     * in both cases.
     */
    public <T, E extends Exception> T record(QueryExecution<T, E> execution, QueryContext context) throws E {
        Instant timestamp = clock.instant();
        long start = System.nanoTime();
        Integer rows = null;
        Throwable failure = null;

        try {
            T result = execution.execute();
            rows = RowCountExtractor.extract(result);
            return result;
        } catch (RuntimeException | Error e) {
            failure = e;
            throw e;
        } catch (Exception e) {
            failure = e;
            throw QueryMonitor.<E>passThrough(e);
        } finally {
            double durationMs = (System.nanoTime() - start) / 1_000_000.0;
            complete(context, durationMs, timestamp, rows, failure == null ? null : describe(failure));
        }
    }

    /**
     * Records a measurement taken by someone else, e.g. an ORM that reports
     * statements after executing them. Nothing is executed here.
     */
    public void recordCompleted(QueryContext context, double durationMs, Instant timestamp, Integer rows, String error) {
        complete(context, durationMs, timestamp != null ? timestamp : clock.instant(), rows, error);
    }

    @SuppressWarnings("unchecked")
    private static <E extends Exception> E passThrough(Exception e) {
        return (E) e;
    }

    private static String describe(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.toString();
    }

    private void complete(QueryContext context, double durationMs, Instant timestamp, Integer rows, String error) {
        try {
            String operation = labelOrUnknown(context.getOperation());
            String table = labelOrUnknown(context.getTable());
            double duration = Double.isFinite(durationMs) ? Math.max(0, durationMs) : 0;
            boolean failed = error != null;

            if (failed) {
                countQuery(operation, table, STATUS_ERROR);
            } else {
                countQuery(operation, table, STATUS_SUCCESS);
                Timer.builder(DURATION_METRIC)
                    .description("Database query duration")
                    .tags("operation", operation, "table", table)
                    .serviceLevelObjectives(DURATION_BUCKETS)
                    .register(meterRegistry)
                    .record((long) (duration * 1_000_000), TimeUnit.NANOSECONDS);
            }

            QueryRecord record = QueryRecord.builder()
                .query(sanitizer.sanitizeQueryText(context.getQueryText() != null ? context.getQueryText() : ""))
                .durationMs(duration)
                .params(sanitizer.sanitizeParams(context.getParams()))
                .rows(rows)
                .error(failed ? sanitizer.sanitizeQueryText(error) : null)
                .timestamp(timestamp)
                .source(context.getSource())
                .build();

            history.append(record);

            boolean slow = duration > properties.getSlowQueryThresholdMs();
            if (slow) {
                Counter.builder(SLOW_QUERIES_METRIC)
                    .description("Total number of slow database queries")
                    .tags("operation", operation, "table", table)
                    .register(meterRegistry)
                    .increment();
                logSlowQuery(record);
            }

            if (failed) {
                log.error("Query failed: {} - {}", record.getError(), describeForLog(record));
            } else if (!slow && properties.isDetailedLogging()) {
                log.debug("Query executed - {}", describeForLog(record));
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record query execution: {}", e.getMessage(), e);
        }
    }

    private void countQuery(String operation, String table, String status) {
        Counter.builder(QUERIES_METRIC)
            .description("Total number of database queries")
            .tags("operation", operation, "table", table, "status", status)
            .register(meterRegistry)
            .increment();
    }

    private static String labelOrUnknown(String label) {
        return label == null || label.isBlank() ? QueryContext.UNKNOWN : label;
    }

    private String describeForLog(QueryRecord record) {
        return String.format("query=%s duration=%.2fms rows=%s source=%s params=%d",
            truncate(record.getQuery(), 200),
            record.getDurationMs(),
            record.getRows(),
            record.getSource(),
            record.getParams() != null ? record.getParams().size() : 0);
    }

    private void logSlowQuery(QueryRecord record) {
        long threshold = properties.getSlowQueryThresholdMs();
        log.warn("SLOW QUERY DETECTED: duration={}ms threshold={}ms rows={} source={} timestamp={} query={}",
            String.format("%.2f", record.getDurationMs()),
            threshold,
            record.getRows(),
            record.getSource(),
            record.getTimestamp(),
            truncate(record.getQuery(), 300));

        if (!properties.isProductionMode()) {
            return;
        }
        try {
            alertSink.send(record, threshold);
        } catch (RuntimeException e) {
            log.warn("Slow-query alert could not be delivered: {}", e.getMessage());
        }
    }

    /**
     * Sets the connection pool gauges.
     */
    public void updatePoolMetrics(int active, int idle, int total) {
        activeConnections.set(active);
        idleConnections.set(idle);
        totalConnections.set(total);
        poolMetrics = new PoolMetricsSnapshot(active, idle, total);
        log.trace("Pool metrics updated: active={} idle={} total={}", active, idle, total);
    }

    public PoolMetricsSnapshot getPoolMetrics() {
        return poolMetrics;
    }

    /**
     * Returns statistics over the current history.
     */
    public QueryStats getQueryStats() {
        List<QueryRecord> records = history.snapshot();
        Instant now = clock.instant();
        long threshold = properties.getSlowQueryThresholdMs();

        List<QueryRecord> last5Minutes = filter(records, within(now, LAST_5_MINUTES));
        List<QueryRecord> lastHour = filter(records, within(now, LAST_HOUR));
        List<QueryRecord> slowQueries = filter(records, r -> r.getDurationMs() > threshold);

        List<SlowQuerySummary> topSlowQueries = slowQueries.stream()
            .sorted(Comparator.comparingDouble(QueryRecord::getDurationMs).reversed())
            .limit(TOP_SLOW_QUERIES)
            .map(r -> SlowQuerySummary.builder()
                .query(truncate(r.getQuery(), SLOW_QUERY_TEXT_LENGTH))
                .durationMs(r.getDurationMs())
                .timestamp(r.getTimestamp())
                .build())
            .collect(Collectors.toList());

        return QueryStats.builder()
            .total(records.size())
            .errors(records.stream().filter(QueryRecord::isFailed).count())
            .last5Minutes(last5Minutes.size())
            .lastHour(lastHour.size())
            .slowQueries(slowQueries.size())
            .slowQueryThresholdMs(threshold)
            .averageDuration(AverageDuration.builder()
                .last5Minutes(averageDuration(last5Minutes))
                .lastHour(averageDuration(lastHour))
                .overall(averageDuration(records))
                .build())
            .topSlowQueries(topSlowQueries)
            .build();
    }

    /**
     * Returns the current state of every meter in the registry.
     */
    public List<MeterSnapshot> getRealTimeMetrics() {
        return meterRegistry.getMeters().stream()
            .map(this::toSnapshot)
            .sorted(Comparator.comparing(MeterSnapshot::getName))
            .collect(Collectors.toList());
    }

    private MeterSnapshot toSnapshot(Meter meter) {
        Meter.Id id = meter.getId();

        Map<String, String> tags = new LinkedHashMap<>();
        for (Tag tag : id.getTags()) {
            tags.put(tag.getKey(), tag.getValue());
        }

        Map<String, Double> measurements = new LinkedHashMap<>();
        for (Measurement measurement : meter.measure()) {
            measurements.put(measurement.getStatistic().getTagValueRepresentation(), measurement.getValue());
        }

        return MeterSnapshot.builder()
            .name(id.getName())
            .type(id.getType().name().toLowerCase())
            .description(id.getDescription())
            .tags(tags)
            .measurements(measurements)
            .build();
    }

    /**
     * Returns the most frequent query shapes in the current history.
     */
    public List<QueryPattern> analyzeQueryPatterns() {
        return patternAnalyzer.analyze(history.snapshot());
    }

    /**
     * Returns a copy of the history, oldest first.
     */
    public List<QueryRecord> getHistory() {
        return history.snapshot();
    }

    private static Predicate<QueryRecord> within(Instant now, Duration window) {
        long windowMs = window.toMillis();
        return r -> r.getTimestamp() != null
            && Duration.between(r.getTimestamp(), now).toMillis() < windowMs;
    }

    private static List<QueryRecord> filter(List<QueryRecord> records, Predicate<QueryRecord> predicate) {
        return records.stream().filter(predicate).collect(Collectors.toList());
    }

    private static double averageDuration(List<QueryRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        double total = records.stream().mapToDouble(QueryRecord::getDurationMs).sum();
        return Math.round(total / records.size() * 100) / 100.0;
    }

    private static String truncate(String query, int maxLength) {
        if (query == null || query.length() <= maxLength) {
            return query;
        }
        return query.substring(0, maxLength) + "...";
    }
}
