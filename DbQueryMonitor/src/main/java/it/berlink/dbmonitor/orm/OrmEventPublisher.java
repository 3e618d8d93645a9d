package it.berlink.dbmonitor.orm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process {@link OrmEventSource}. Events are delivered synchronously on the
 * publishing thread; a failing handler is logged and does not affect the others
 * or the publisher.
 */
@Slf4j
@Component
public class OrmEventPublisher implements OrmEventSource {

    private final List<OrmEventHandler> handlers = new CopyOnWriteArrayList<>();

    @Override
    public void subscribe(OrmEventHandler handler) {
        handlers.add(handler);
        log.debug("ORM event handler subscribed: {}", handler.getClass().getSimpleName());
    }

    public void publishQuery(OrmQueryEvent event) {
        dispatch(handler -> handler.onQuery(event));
    }

    public void publishLog(OrmLogEvent event) {
        dispatch(handler -> handler.onLog(event));
    }

    private void dispatch(Consumer<OrmEventHandler> delivery) {
        for (OrmEventHandler handler : handlers) {
            try {
                delivery.accept(handler);
            } catch (RuntimeException e) {
                log.warn("ORM event handler {} failed: {}", handler.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
