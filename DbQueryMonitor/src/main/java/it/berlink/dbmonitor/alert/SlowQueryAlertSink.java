package it.berlink.dbmonitor.alert;

import it.berlink.dbmonitor.model.QueryRecord;

/**
 * External destination for slow-query alerts.
 *
 * Implementations must return quickly: they are called on the thread that
 * completed the query.
 */
public interface SlowQueryAlertSink extends AutoCloseable {

    void send(QueryRecord record, long thresholdMs);

    @Override
    default void close() {
    }
}
