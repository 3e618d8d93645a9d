package it.berlink.dbmonitor.orm;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Diagnostic message emitted by the ORM itself.
 */
@Value
@Builder
public class OrmLogEvent {

    OrmLogLevel level;
    String message;
    String target;
    Instant timestamp;
}
