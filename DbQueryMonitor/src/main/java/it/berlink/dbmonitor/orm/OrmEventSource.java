package it.berlink.dbmonitor.orm;

/**
 * Stream of events fed by the ORM integration layer.
 */
public interface OrmEventSource {

    void subscribe(OrmEventHandler handler);
}
