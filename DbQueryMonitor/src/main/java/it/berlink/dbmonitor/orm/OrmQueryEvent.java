package it.berlink.dbmonitor.orm;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A statement the ORM has already executed, with the duration it measured.
 */
@Value
@Builder
public class OrmQueryEvent {

    String query;
    List<Object> params;
    double durationMs;
    String target;
    Instant timestamp;
}
