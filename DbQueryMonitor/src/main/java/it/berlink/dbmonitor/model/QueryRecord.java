package it.berlink.dbmonitor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One observed execution. Query text and params are already sanitized.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryRecord {

    String query;
    double durationMs;
    List<Object> params;
    Integer rows;
    String error;
    Instant timestamp;
    QuerySource source;

    public boolean isFailed() {
        return error != null;
    }
}
