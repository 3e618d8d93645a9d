package it.berlink.dbmonitor.orm;

/**
 * Receives the events published by an {@link OrmEventSource}.
 */
public interface OrmEventHandler {

    void onQuery(OrmQueryEvent event);

    default void onLog(OrmLogEvent event) {
    }
}
