package it.berlink.dbmonitor.pattern;

import it.berlink.dbmonitor.model.QueryPattern;
import it.berlink.dbmonitor.model.QueryRecord;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Groups recorded executions by query shape.
 */
@Component
public class QueryPatternAnalyzer {

    public static final int MAX_PATTERNS = 20;

    private static final Pattern POSITIONAL_PARAM = Pattern.compile("\\$\\d+");
    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final Pattern STRING_LITERAL = Pattern.compile("'[^']*'");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Folds the records into patterns and returns the most frequent ones.
     * Ties keep the order in which the pattern was first seen.
     */
    public List<QueryPattern> analyze(List<QueryRecord> records) {
        Map<String, QueryPattern> patterns = new LinkedHashMap<>();

        for (QueryRecord record : records) {
            String normalized = normalizeQuery(record.getQuery());
            QueryPattern stats = patterns.computeIfAbsent(normalized, p -> QueryPattern.builder()
                .pattern(p)
                .patternHash(computeHash(p))
                .build());

            stats.setCount(stats.getCount() + 1);
            stats.setTotalDurationMs(stats.getTotalDurationMs() + record.getDurationMs());
            stats.setAvgDurationMs(stats.getTotalDurationMs() / stats.getCount());
        }

        return patterns.values().stream()
            .sorted(Comparator.comparingLong(QueryPattern::getCount).reversed())
            .limit(MAX_PATTERNS)
            .collect(Collectors.toList());
    }

    /**
     * Normalizes a SQL query by replacing literal values with placeholders.
     * This allows grouping similar queries together.
     */
    public String normalizeQuery(String query) {
        if (query == null) {
            return "";
        }

        String normalized = POSITIONAL_PARAM.matcher(query).replaceAll("\\$?");
        normalized = NUMBER.matcher(normalized).replaceAll("?");
        normalized = STRING_LITERAL.matcher(normalized).replaceAll("'?'");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        return normalized.trim().toLowerCase();
    }

    /**
     * Computes a short MD5 hash of the normalized query.
     */
    String computeHash(String normalizedQuery) {
        return DigestUtils.md5Hex(normalizedQuery).substring(0, 16);
    }
}
