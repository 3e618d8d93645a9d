package it.berlink.dbmonitor.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Labels attached to a single monitored call.
 */
@Value
@Builder
public class QueryContext {

    public static final String UNKNOWN = "unknown";

    String queryText;
    List<Object> params;

    @Builder.Default
    String operation = UNKNOWN;

    @Builder.Default
    String table = UNKNOWN;

    QuerySource source;
}
