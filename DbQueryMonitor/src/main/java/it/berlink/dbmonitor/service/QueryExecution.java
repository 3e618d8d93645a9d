package it.berlink.dbmonitor.service;

/**
 * A query call handed to {@link QueryMonitor#record}.
 *
 * @param <T> result type
 * @param <E> checked exception the call may throw, passed through unchanged
 */
@FunctionalInterface
public interface QueryExecution<T, E extends Exception> {

    T execute() throws E;
}
