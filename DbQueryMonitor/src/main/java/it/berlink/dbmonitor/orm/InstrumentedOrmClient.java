package it.berlink.dbmonitor.orm;

import it.berlink.dbmonitor.model.QueryContext;
import it.berlink.dbmonitor.model.QuerySource;
import it.berlink.dbmonitor.service.QueryMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * ORM instrumentation.
 *
 * Statements reported on the ORM event stream are recorded as completed
 * measurements with source {@code orm}. The convenience operations run a
 * registered model call through {@link QueryMonitor#record} with source
 * {@code wrapper}, the model name as table and an explicit operation label.
 */
@Component
public class InstrumentedOrmClient {

    static final String ORM_LOGGER = "db.orm";

    private static final Logger ormLog = LoggerFactory.getLogger(ORM_LOGGER);

    private final ModelRegistry registry;
    private final QueryMonitor monitor;
    private final OrmStatementClassifier classifier;

    public InstrumentedOrmClient(
            OrmEventSource eventSource,
            ModelRegistry registry,
            QueryMonitor monitor,
            OrmStatementClassifier classifier) {
        this.registry = registry;
        this.monitor = monitor;
        this.classifier = classifier;
        eventSource.subscribe(new EventForwarder());
    }

    public List<Map<String, Object>> findMany(String model, Map<String, Object> where) {
        return findMany(model, where, null);
    }

    public List<Map<String, Object>> findMany(String model, Map<String, Object> where, String operation) {
        ModelDelegate delegate = registry.resolve(model, ModelOperation.FIND_MANY);
        return monitor.record(() -> delegate.getFindMany().apply(where),
            wrapperContext(model, ModelOperation.FIND_MANY, operation, where));
    }

    public Map<String, Object> create(String model, Map<String, Object> data) {
        return create(model, data, null);
    }

    public Map<String, Object> create(String model, Map<String, Object> data, String operation) {
        ModelDelegate delegate = registry.resolve(model, ModelOperation.CREATE);
        return monitor.record(() -> delegate.getCreate().apply(data),
            wrapperContext(model, ModelOperation.CREATE, operation, data));
    }

    public Map<String, Object> update(String model, Map<String, Object> where, Map<String, Object> data) {
        return update(model, where, data, null);
    }

    public Map<String, Object> update(String model, Map<String, Object> where, Map<String, Object> data,
                                      String operation) {
        ModelDelegate delegate = registry.resolve(model, ModelOperation.UPDATE);
        return monitor.record(() -> delegate.getUpdate().apply(where, data),
            wrapperContext(model, ModelOperation.UPDATE, operation, where));
    }

    public Map<String, Object> delete(String model, Map<String, Object> where) {
        return delete(model, where, null);
    }

    public Map<String, Object> delete(String model, Map<String, Object> where, String operation) {
        ModelDelegate delegate = registry.resolve(model, ModelOperation.DELETE);
        return monitor.record(() -> delegate.getDelete().apply(where),
            wrapperContext(model, ModelOperation.DELETE, operation, where));
    }

    private QueryContext wrapperContext(String model, ModelOperation kind, String operation,
                                        Map<String, Object> args) {
        return QueryContext.builder()
            .queryText(model + "." + camelCase(kind) + "(" + (args != null ? args.keySet() : "") + ")")
            .params(args != null ? new ArrayList<>(args.values()) : null)
            .operation(operation != null && !operation.isBlank() ? operation : kind.defaultLabel())
            .table(model)
            .source(QuerySource.WRAPPER)
            .build();
    }

    private static String camelCase(ModelOperation kind) {
        String[] parts = kind.name().toLowerCase().split("_");
        StringBuilder name = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            name.append(Character.toUpperCase(parts[i].charAt(0))).append(parts[i].substring(1));
        }
        return name.toString();
    }

    private class EventForwarder implements OrmEventHandler {

        @Override
        public void onQuery(OrmQueryEvent event) {
            QueryContext context = QueryContext.builder()
                .queryText(event.getQuery())
                .params(event.getParams())
                .operation(classifier.operation(event.getQuery()))
                .table(classifier.table(event.getQuery()))
                .source(QuerySource.ORM)
                .build();
            monitor.recordCompleted(context, event.getDurationMs(), event.getTimestamp(), null, null);
        }

        @Override
        public void onLog(OrmLogEvent event) {
            if (event.getLevel() == null) {
                ormLog.info("{}", event.getMessage());
                return;
            }
            switch (event.getLevel()) {
                case WARN -> ormLog.warn("{}", event.getMessage());
                case ERROR -> ormLog.error("{}", event.getMessage());
                default -> ormLog.info("{}", event.getMessage());
            }
        }
    }
}
