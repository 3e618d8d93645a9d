package it.berlink.dbmonitor.pool;

/**
 * Lifecycle callbacks emitted by a {@link DatabasePool}.
 */
public interface PoolEventListener {

    /** A new physical connection was opened. */
    default void onConnect(PoolConnection connection) {
    }

    /** A physical connection was closed and removed from the pool. */
    default void onRemove(PoolConnection connection) {
    }

    /** An idle connection failed in the background. */
    default void onError(Throwable error, PoolConnection connection) {
    }
}
