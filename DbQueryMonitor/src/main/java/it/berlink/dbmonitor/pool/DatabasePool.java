package it.berlink.dbmonitor.pool;

import java.sql.SQLException;
import java.util.List;

/**
 * Connection pool as seen by the instrumentation layer.
 */
public interface DatabasePool {

    /**
     * Runs a statement on any pooled connection.
     */
    QueryResult query(String text, List<Object> params) throws SQLException;

    /**
     * Checks out a connection; the caller must close it.
     */
    PoolConnection connect() throws SQLException;

    int activeCount();

    int idleCount();

    int totalCount();

    void addListener(PoolEventListener listener);
}
