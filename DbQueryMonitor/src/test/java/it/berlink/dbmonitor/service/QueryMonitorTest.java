package it.berlink.dbmonitor.service;

import it.berlink.dbmonitor.alert.SlowQueryAlertSink;
import it.berlink.dbmonitor.config.QueryMonitorProperties;
import it.berlink.dbmonitor.model.MeterSnapshot;
import it.berlink.dbmonitor.model.QueryContext;
import it.berlink.dbmonitor.model.QueryPattern;
import it.berlink.dbmonitor.model.QueryRecord;
import it.berlink.dbmonitor.model.QuerySource;
import it.berlink.dbmonitor.model.QueryStats;
import it.berlink.dbmonitor.pattern.QueryPatternAnalyzer;
import it.berlink.dbmonitor.sanitizer.QuerySanitizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(OutputCaptureExtension.class)
class QueryMonitorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private SimpleMeterRegistry registry;
    private QueryMonitorProperties properties;
    private SlowQueryAlertSink alertSink;
    private QueryMonitor monitor;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new QueryMonitorProperties();
        alertSink = mock(SlowQueryAlertSink.class);
        monitor = newMonitor(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private QueryMonitor newMonitor(Clock clock) {
        return new QueryMonitor(registry, properties, new QuerySanitizer(),
            new QueryPatternAnalyzer(), alertSink, clock);
    }

    private static QueryContext context(String query) {
        return QueryContext.builder()
            .queryText(query)
            .operation("select")
            .table("users")
            .source(QuerySource.POOL)
            .build();
    }

    private static String lineWith(CapturedOutput output, String text) {
        return output.getOut().lines()
            .filter(line -> line.contains(text))
            .findFirst()
            .orElse("");
    }

    private double successCount() {
        return registry.get(QueryMonitor.QUERIES_METRIC)
            .tags("operation", "select", "table", "users", "status", QueryMonitor.STATUS_SUCCESS)
            .counter().count();
    }

    @Test
    void shouldReturnExactlyWhatTheExecutionReturns() {
        List<String> value = List.of("alice", "bob");

        List<String> result = monitor.record(() -> value, context("SELECT name FROM users"));

        assertThat(result).isSameAs(value);
        assertThat(successCount()).isEqualTo(1.0);
        assertThat(registry.get(QueryMonitor.DURATION_METRIC)
            .tags("operation", "select", "table", "users")
            .timer().count()).isEqualTo(1);

        QueryRecord record = monitor.getHistory().get(0);
        assertThat(record.getRows()).isEqualTo(2);
        assertThat(record.getError()).isNull();
        assertThat(record.getDurationMs()).isGreaterThanOrEqualTo(0);
        assertThat(record.getSource()).isEqualTo(QuerySource.POOL);
        assertThat(record.getTimestamp()).isEqualTo(NOW);
    }

    @Test
    void shouldRethrowTheOriginalErrorAndRecordItOnce() {
        SQLException failure = new SQLException("relation \"userz\" does not exist", "42P01");

        assertThatThrownBy(() -> monitor.record(() -> {
            throw failure;
        }, context("SELECT * FROM userz")))
            .isSameAs(failure);

        assertThat(monitor.getHistory()).hasSize(1);
        QueryRecord record = monitor.getHistory().get(0);
        assertThat(record.getError()).isEqualTo("relation \"userz\" does not exist");
        assertThat(record.getRows()).isNull();
        assertThat(registry.get(QueryMonitor.QUERIES_METRIC)
            .tags("operation", "select", "table", "users", "status", QueryMonitor.STATUS_ERROR)
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.find(QueryMonitor.DURATION_METRIC).timer()).isNull();
    }

    @Test
    void shouldRethrowUncheckedErrorsUnchanged() {
        IllegalStateException failure = new IllegalStateException();

        assertThatThrownBy(() -> monitor.record(() -> {
            throw failure;
        }, context("SELECT 1")))
            .isSameAs(failure);

        assertThat(monitor.getHistory())
            .singleElement()
            .extracting(QueryRecord::getError)
            .isEqualTo("java.lang.IllegalStateException");
    }

    @Test
    void shouldKeepOnlyTheMostRecentRecords() {
        for (int i = 0; i < 1005; i++) {
            int n = i;
            monitor.record(() -> n, context("SELECT " + n));
        }

        List<QueryRecord> history = monitor.getHistory();
        assertThat(history).hasSize(1000);
        assertThat(history.get(0).getQuery()).isEqualTo("SELECT 5");
        assertThat(history.get(999).getQuery()).isEqualTo("SELECT 1004");
        assertThat(successCount()).isEqualTo(1005.0);
    }

    @Test
    void shouldHonourConfiguredHistorySize() {
        properties.setMaxHistorySize(2);
        QueryMonitor small = newMonitor(Clock.fixed(NOW, ZoneOffset.UTC));

        for (int i = 0; i < 5; i++) {
            small.record(() -> "ok", context("SELECT " + i));
        }

        assertThat(small.getHistory()).extracting(QueryRecord::getQuery)
            .containsExactly("SELECT 3", "SELECT 4");
    }

    @Test
    void shouldSanitizeBeforeStoring() {
        QueryContext context = QueryContext.builder()
            .queryText("UPDATE users SET password = 'hunter2' WHERE id = $1")
            .params(List.of(7, "z".repeat(64)))
            .operation("update")
            .table("users")
            .source(QuerySource.CLIENT)
            .build();

        monitor.record(() -> 1, context);

        QueryRecord record = monitor.getHistory().get(0);
        assertThat(record.getQuery()).doesNotContain("hunter2").contains(QuerySanitizer.REDACTED);
        assertThat(record.getParams()).containsExactly(7, QuerySanitizer.REDACTED);
    }

    @Test
    void shouldDetectSlowQueriesAndSkipAlertOutsideProduction() throws Exception {
        properties.setSlowQueryThresholdMs(5);

        monitor.record(() -> {
            Thread.sleep(30);
            return "done";
        }, context("SELECT pg_sleep(0.03)"));

        assertThat(registry.get(QueryMonitor.SLOW_QUERIES_METRIC)
            .tags("operation", "select", "table", "users")
            .counter().count()).isEqualTo(1.0);
        assertThat(monitor.getQueryStats().getSlowQueries()).isEqualTo(1);
        verify(alertSink, never()).send(any(), anyLong());
    }

    @Test
    void shouldForwardSlowQueryAlertInProduction() {
        properties.setProductionMode(true);
        properties.setSlowQueryThresholdMs(1000);

        monitor.recordCompleted(context("SELECT * FROM big_table"), 2500, NOW, null, null);

        verify(alertSink).send(any(QueryRecord.class), eq(1000L));
    }

    @Test
    void shouldNotLetAlertFailuresReachTheCaller() {
        properties.setProductionMode(true);
        properties.setSlowQueryThresholdMs(0);
        doThrow(new IllegalStateException("webhook down")).when(alertSink).send(any(), anyLong());

        monitor.recordCompleted(context("SELECT 1"), 10, NOW, null, null);

        assertThat(monitor.getHistory()).hasSize(1);
    }

    @Test
    void shouldReturnZeroStatsForEmptyHistory() {
        QueryStats stats = monitor.getQueryStats();

        assertThat(stats.getTotal()).isZero();
        assertThat(stats.getLast5Minutes()).isZero();
        assertThat(stats.getLastHour()).isZero();
        assertThat(stats.getSlowQueries()).isZero();
        assertThat(stats.getErrors()).isZero();
        assertThat(stats.getAverageDuration().getOverall()).isZero();
        assertThat(stats.getAverageDuration().getLast5Minutes()).isZero();
        assertThat(stats.getAverageDuration().getLastHour()).isZero();
        assertThat(stats.getTopSlowQueries()).isEmpty();
    }

    @Test
    void shouldComputeWindowedStats() {
        monitor.recordCompleted(context("SELECT a"), 10, NOW.minus(Duration.ofMinutes(1)), null, null);
        monitor.recordCompleted(context("SELECT b"), 20, NOW.minus(Duration.ofMinutes(30)), null, null);
        monitor.recordCompleted(context("SELECT c"), 33.333, NOW.minus(Duration.ofHours(2)), null, null);
        monitor.recordCompleted(context("SELECT d"), 5, NOW.minus(Duration.ofMinutes(2)), null, "timeout");

        QueryStats stats = monitor.getQueryStats();

        assertThat(stats.getTotal()).isEqualTo(4);
        assertThat(stats.getLast5Minutes()).isEqualTo(2);
        assertThat(stats.getLastHour()).isEqualTo(3);
        assertThat(stats.getErrors()).isEqualTo(1);
        assertThat(stats.getAverageDuration().getLast5Minutes()).isEqualTo(7.5);
        assertThat(stats.getAverageDuration().getLastHour()).isEqualTo(11.67);
        assertThat(stats.getAverageDuration().getOverall()).isEqualTo(17.08);
        assertThat(stats.getLast5Minutes()).isLessThanOrEqualTo(stats.getLastHour());
        assertThat(stats.getLastHour()).isLessThanOrEqualTo(stats.getTotal());
        assertThat(stats.getTotal()).isEqualTo(monitor.getHistory().size());
    }

    @Test
    void shouldListTopSlowQueriesTruncated() {
        String longQuery = "SELECT " + "column_name, ".repeat(20) + "id FROM wide_table";
        monitor.recordCompleted(context("SELECT fast"), 10, NOW, null, null);
        monitor.recordCompleted(context("SELECT slow"), 1500, NOW, null, null);
        monitor.recordCompleted(context(longQuery), 3000, NOW, null, null);

        QueryStats stats = monitor.getQueryStats();

        assertThat(stats.getSlowQueries()).isEqualTo(2);
        assertThat(stats.getTopSlowQueries()).hasSize(2);
        assertThat(stats.getTopSlowQueries().get(0).getDurationMs()).isEqualTo(3000);
        assertThat(stats.getTopSlowQueries().get(0).getQuery())
            .hasSize(103)
            .endsWith("...");
        assertThat(stats.getTopSlowQueries().get(1).getQuery()).isEqualTo("SELECT slow");
    }

    @Test
    void shouldFoldQueriesIntoPatterns() {
        monitor.record(() -> 1, context("SELECT * FROM t WHERE id=1"));
        monitor.record(() -> 1, context("SELECT * FROM t WHERE id=2"));
        monitor.record(() -> 1, context("DELETE FROM t WHERE id=3"));

        List<QueryPattern> patterns = monitor.analyzeQueryPatterns();

        assertThat(patterns).hasSize(2);
        assertThat(patterns.get(0).getPattern()).isEqualTo("select * from t where id=?");
        assertThat(patterns.get(0).getCount()).isEqualTo(2);
    }

    @Test
    void shouldUpdatePoolGauges() {
        monitor.updatePoolMetrics(3, 7, 10);

        assertThat(registry.get(QueryMonitor.POOL_SIZE_METRIC).tag("status", "active").gauge().value())
            .isEqualTo(3.0);
        assertThat(registry.get(QueryMonitor.POOL_SIZE_METRIC).tag("status", "idle").gauge().value())
            .isEqualTo(7.0);
        assertThat(registry.get(QueryMonitor.POOL_SIZE_METRIC).tag("status", "total").gauge().value())
            .isEqualTo(10.0);
        assertThat(monitor.getPoolMetrics().getTotal()).isEqualTo(10);
    }

    @Test
    void shouldExposeRegistryContent() {
        monitor.record(() -> "x", context("SELECT 1"));

        List<MeterSnapshot> metrics = monitor.getRealTimeMetrics();

        assertThat(metrics).extracting(MeterSnapshot::getName)
            .contains(QueryMonitor.QUERIES_METRIC, QueryMonitor.DURATION_METRIC, QueryMonitor.POOL_SIZE_METRIC);
        MeterSnapshot counter = metrics.stream()
            .filter(m -> m.getName().equals(QueryMonitor.QUERIES_METRIC))
            .findFirst()
            .orElseThrow();
        assertThat(counter.getType()).isEqualTo("counter");
        assertThat(counter.getTags()).containsEntry("status", "success");
        assertThat(counter.getMeasurements()).containsEntry("count", 1.0);
    }

    @Test
    void shouldLabelMissingOperationAndTableAsUnknown() {
        monitor.record(() -> "x", QueryContext.builder()
            .queryText("VACUUM")
            .source(QuerySource.POOL)
            .build());

        assertThat(registry.get(QueryMonitor.QUERIES_METRIC)
            .tags("operation", "unknown", "table", "unknown", "status", "success")
            .counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordEveryConcurrentCallExactlyOnce() throws Exception {
        monitor = newMonitor(Clock.systemUTC());
        int calls = 200;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int i = 0; i < calls; i++) {
                int n = i;
                tasks.add(() -> monitor.record(() -> {
                    Thread.sleep(1 + n % 3);
                    return n;
                }, context("SELECT " + n)));
            }

            List<Integer> results = new ArrayList<>();
            for (Future<Integer> future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }

            Set<String> recorded = monitor.getHistory().stream()
                .map(QueryRecord::getQuery)
                .collect(Collectors.toSet());
            assertThat(results).hasSize(calls).doesNotHaveDuplicates();
            assertThat(successCount()).isEqualTo(calls);
            assertThat(monitor.getHistory()).hasSize(calls);
            assertThat(recorded).hasSize(calls);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldStoreZeroForUnusableReportedDurations() {
        monitor.recordCompleted(context("SELECT * FROM users WHERE id = 1"), Double.NaN, NOW, null, null);
        monitor.recordCompleted(context("SELECT * FROM users WHERE id = 2"), Double.POSITIVE_INFINITY, NOW, null, null);
        monitor.recordCompleted(context("SELECT * FROM users WHERE id = 3"), -4, NOW, null, null);

        assertThat(monitor.getHistory())
            .extracting(QueryRecord::getDurationMs)
            .containsExactly(0.0, 0.0, 0.0);
        assertThat(monitor.analyzeQueryPatterns()).singleElement()
            .satisfies(p -> {
                assertThat(p.getTotalDurationMs()).isEqualTo(0.0);
                assertThat(p.getAvgDurationMs()).isEqualTo(0.0);
            });
        assertThat(monitor.getQueryStats().getSlowQueries()).isZero();
    }

    @Test
    void shouldLogFailuresAtErrorAndSlowQueriesAtWarnWithoutDetailedLogging(CapturedOutput output) {
        properties.setDetailedLogging(false);
        properties.setSlowQueryThresholdMs(1000);

        monitor.recordCompleted(context("SELECT * FROM orders_failed"), 12, NOW, null, "deadlock detected");
        monitor.recordCompleted(context("SELECT * FROM orders_slow"), 1800, NOW, null, null);
        monitor.recordCompleted(context("SELECT * FROM orders_fast"), 3, NOW, null, null);

        assertThat(lineWith(output, "Query failed: deadlock detected"))
            .contains("ERROR")
            .contains("orders_failed");
        assertThat(lineWith(output, "SLOW QUERY DETECTED"))
            .contains("WARN")
            .contains("threshold=1000ms")
            .contains("orders_slow");
        assertThat(output.getOut()).doesNotContain("Query executed").doesNotContain("orders_fast");
    }

    @Test
    void shouldLogFastQueriesAtDebugOnlyWithDetailedLogging(CapturedOutput output) {
        properties.setDetailedLogging(true);
        properties.setSlowQueryThresholdMs(1000);

        monitor.recordCompleted(context("SELECT * FROM invoices_fast"), 3, NOW, null, null);
        monitor.recordCompleted(context("SELECT * FROM invoices_slow"), 1800, NOW, null, null);

        assertThat(lineWith(output, "Query executed"))
            .contains("DEBUG")
            .contains("invoices_fast");
        assertThat(output.getOut().lines().filter(line -> line.contains("Query executed")))
            .noneMatch(line -> line.contains("invoices_slow"));
        assertThat(lineWith(output, "SLOW QUERY DETECTED")).contains("WARN").contains("invoices_slow");
    }
}
