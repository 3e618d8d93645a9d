package it.berlink.dbmonitor.pool;

import java.sql.SQLException;
import java.util.List;

/**
 * A connection checked out of a {@link DatabasePool}. Closing returns it to the pool.
 */
public interface PoolConnection extends AutoCloseable {

    QueryResult query(String text, List<Object> params) throws SQLException;

    @Override
    void close() throws SQLException;
}
