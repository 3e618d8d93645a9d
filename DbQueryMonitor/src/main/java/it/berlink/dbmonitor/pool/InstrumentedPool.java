package it.berlink.dbmonitor.pool;

import it.berlink.dbmonitor.model.QueryContext;
import it.berlink.dbmonitor.model.QuerySource;
import it.berlink.dbmonitor.service.QueryMonitor;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.util.List;

/**
 * {@link DatabasePool} that records every statement in the {@link QueryMonitor}.
 *
 * Holds the real pool and forwards to it; results, timeouts and errors of the
 * pool are returned unchanged. Pool connect/remove events refresh the pool gauges.
 */
@Slf4j
public class InstrumentedPool implements DatabasePool {

    private final DatabasePool delegate;
    private final QueryMonitor monitor;
    private final PoolStatementClassifier classifier;

    InstrumentedPool(DatabasePool delegate, QueryMonitor monitor, PoolStatementClassifier classifier) {
        this.delegate = delegate;
        this.monitor = monitor;
        this.classifier = classifier;
        delegate.addListener(new MetricsListener());
    }

    @Override
    public QueryResult query(String text, List<Object> params) throws SQLException {
        return monitor.record(() -> delegate.query(text, params), context(text, params, QuerySource.POOL));
    }

    @Override
    public PoolConnection connect() throws SQLException {
        return new InstrumentedConnection(delegate.connect(), this);
    }

    @Override
    public int activeCount() {
        return delegate.activeCount();
    }

    @Override
    public int idleCount() {
        return delegate.idleCount();
    }

    @Override
    public int totalCount() {
        return delegate.totalCount();
    }

    @Override
    public void addListener(PoolEventListener listener) {
        delegate.addListener(listener);
    }

    QueryMonitor monitor() {
        return monitor;
    }

    QueryContext context(String text, List<Object> params, QuerySource source) {
        return QueryContext.builder()
            .queryText(text)
            .params(params)
            .operation(classifier.operation(text))
            .table(classifier.table(text))
            .source(source)
            .build();
    }

    private void refreshPoolMetrics() {
        monitor.updatePoolMetrics(delegate.activeCount(), delegate.idleCount(), delegate.totalCount());
    }

    private class MetricsListener implements PoolEventListener {

        @Override
        public void onConnect(PoolConnection connection) {
            refreshPoolMetrics();
        }

        @Override
        public void onRemove(PoolConnection connection) {
            refreshPoolMetrics();
        }

        @Override
        public void onError(Throwable error, PoolConnection connection) {
            log.error("Database pool error: {}", error.getMessage(), error);
        }
    }
}
