package it.berlink.dbmonitor.pool;

import it.berlink.dbmonitor.model.QuerySource;

import java.sql.SQLException;
import java.util.List;

/**
 * Checked-out connection whose statements are recorded with source {@code client}.
 */
public class InstrumentedConnection implements PoolConnection {

    private final PoolConnection delegate;
    private final InstrumentedPool pool;

    InstrumentedConnection(PoolConnection delegate, InstrumentedPool pool) {
        this.delegate = delegate;
        this.pool = pool;
    }

    @Override
    public QueryResult query(String text, List<Object> params) throws SQLException {
        return pool.monitor().record(() -> delegate.query(text, params),
            pool.context(text, params, QuerySource.CLIENT));
    }

    @Override
    public void close() throws SQLException {
        delegate.close();
    }
}
