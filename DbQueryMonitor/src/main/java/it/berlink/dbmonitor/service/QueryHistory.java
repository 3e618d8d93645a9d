package it.berlink.dbmonitor.service;

import it.berlink.dbmonitor.model.QueryRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of the most recently completed executions.
 *
 * Records are ordered by the moment they are appended, which is the
 * completion order of the monitored calls, not their start order.
 * The lock is held only for the append/evict step and for copying a snapshot.
 */
public class QueryHistory {

    private final int capacity;
    private final ArrayDeque<QueryRecord> records;
    private final ReentrantLock lock = new ReentrantLock();

    public QueryHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.records = new ArrayDeque<>(capacity);
    }

    public void append(QueryRecord record) {
        lock.lock();
        try {
            if (records.size() == capacity) {
                records.pollFirst();
            }
            records.addLast(record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a copy of the current content, oldest first.
     */
    public List<QueryRecord> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(records);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }
}
