package it.berlink.dbmonitor.pool;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a statement run through a {@link DatabasePool}.
 */
@Value
@Builder
public class QueryResult {

    String command;

    /** Rows affected or returned, as reported by the driver. */
    Integer rowCount;

    @Singular
    List<Map<String, Object>> rows;
}
