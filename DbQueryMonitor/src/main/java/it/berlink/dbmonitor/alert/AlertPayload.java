package it.berlink.dbmonitor.alert;

import it.berlink.dbmonitor.model.QueryRecord;
import it.berlink.dbmonitor.model.QuerySource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JSON body posted to the alert webhook.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertPayload {

    static final int MAX_QUERY_LENGTH = 100;

    private String type;
    private double durationMs;
    private long thresholdMs;
    private String query;
    private QuerySource source;
    private Instant timestamp;

    static AlertPayload of(QueryRecord record, long thresholdMs) {
        return AlertPayload.builder()
            .type("slow_query")
            .durationMs(record.getDurationMs())
            .thresholdMs(thresholdMs)
            .query(abbreviate(record.getQuery()))
            .source(record.getSource())
            .timestamp(record.getTimestamp())
            .build();
    }

    static String abbreviate(String query) {
        if (query == null || query.length() <= MAX_QUERY_LENGTH) {
            return query;
        }
        return query.substring(0, MAX_QUERY_LENGTH);
    }
}
