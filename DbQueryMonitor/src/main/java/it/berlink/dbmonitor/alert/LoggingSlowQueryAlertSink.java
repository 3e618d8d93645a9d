package it.berlink.dbmonitor.alert;

import it.berlink.dbmonitor.model.QueryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes alerts to a dedicated logger so they can be routed by the logging backend.
 */
public class LoggingSlowQueryAlertSink implements SlowQueryAlertSink {

    static final String ALERT_LOGGER = "db.slow-query-alerts";

    private static final Logger alertLog = LoggerFactory.getLogger(ALERT_LOGGER);

    @Override
    public void send(QueryRecord record, long thresholdMs) {
        alertLog.warn("SLOW QUERY ALERT: duration={}ms threshold={}ms source={} timestamp={} query={}",
            String.format("%.2f", record.getDurationMs()),
            thresholdMs,
            record.getSource(),
            record.getTimestamp(),
            AlertPayload.abbreviate(record.getQuery()));
    }
}
