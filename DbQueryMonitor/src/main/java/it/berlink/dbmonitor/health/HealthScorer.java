package it.berlink.dbmonitor.health;

import it.berlink.dbmonitor.model.HealthReport;
import it.berlink.dbmonitor.model.HealthScore;
import it.berlink.dbmonitor.model.HealthStatus;
import it.berlink.dbmonitor.model.QueryPattern;
import it.berlink.dbmonitor.model.QueryStats;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns query statistics into a 0-100 health score and advice.
 */
@Component
public class HealthScorer {

    static final String SLOW_QUERIES_ADVICE =
        "Slow queries detected: review indexes on the involved tables and optimize the slowest statements";
    static final String HIGH_AVERAGE_ADVICE =
        "Average query duration is above 100ms: consider query optimization and connection pool tuning";
    static final String HIGH_VOLUME_ADVICE =
        "More than 1000 queries in the last 5 minutes: consider caching frequently read data";
    static final String LOOKS_GOOD =
        "Database performance looks good";

    private static final double HIGH_AVERAGE_MS = 100;
    private static final long HIGH_LOAD_5_MINUTES = 500;
    private static final long VERY_HIGH_LOAD_5_MINUTES = 1000;
    private static final double SLOW_PATTERN_MS = 200;

    private final Clock clock;

    public HealthScorer(Clock clock) {
        this.clock = clock;
    }

    public HealthScore score(QueryStats stats) {
        double score = 100;

        if (stats.getSlowQueries() > 0 && stats.getTotal() > 0) {
            double slowPercent = (double) stats.getSlowQueries() / stats.getTotal() * 100;
            score -= Math.min(slowPercent * 2, 40);
        }

        double overallAvg = overallAverage(stats);
        if (overallAvg > HIGH_AVERAGE_MS) {
            score -= Math.min((overallAvg - HIGH_AVERAGE_MS) / 10, 30);
        }

        if (stats.getLast5Minutes() > HIGH_LOAD_5_MINUTES) {
            score -= Math.min((stats.getLast5Minutes() - HIGH_LOAD_5_MINUTES) / 50.0, 20);
        }

        int rounded = (int) Math.round(Math.max(score, 0));
        return new HealthScore(rounded, statusFor(rounded));
    }

    static HealthStatus statusFor(int score) {
        if (score > 80) {
            return HealthStatus.HEALTHY;
        }
        if (score > 60) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.CRITICAL;
    }

    public List<String> recommendations(QueryStats stats, List<QueryPattern> patterns) {
        List<String> recommendations = new ArrayList<>();

        if (stats.getSlowQueries() > 0) {
            recommendations.add(SLOW_QUERIES_ADVICE);
        }
        if (overallAverage(stats) > HIGH_AVERAGE_MS) {
            recommendations.add(HIGH_AVERAGE_ADVICE);
        }
        if (stats.getLast5Minutes() > VERY_HIGH_LOAD_5_MINUTES) {
            recommendations.add(HIGH_VOLUME_ADVICE);
        }
        if (patterns != null && !patterns.isEmpty()) {
            QueryPattern top = patterns.get(0);
            if (top.getAvgDurationMs() > SLOW_PATTERN_MS) {
                recommendations.add(String.format(
                    "Most frequent query pattern averages %.2fms over %d executions, consider optimizing: %s",
                    top.getAvgDurationMs(), top.getCount(), top.getPattern()));
            }
        }

        if (recommendations.isEmpty()) {
            recommendations.add(LOOKS_GOOD);
        }
        return recommendations;
    }

    public HealthReport evaluate(QueryStats stats, List<QueryPattern> patterns) {
        HealthScore score = score(stats);
        return HealthReport.builder()
            .score(score.getScore())
            .status(score.getStatus())
            .recommendations(recommendations(stats, patterns))
            .stats(stats)
            .generatedAt(clock.instant())
            .build();
    }

    private static double overallAverage(QueryStats stats) {
        return stats.getAverageDuration() != null ? stats.getAverageDuration().getOverall() : 0;
    }
}
