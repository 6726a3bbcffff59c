package io.tupledb.datastore;

public enum ExecutionMode {
    /**
     * Drain every matching row before {@code execute} returns. A bad row fails the whole call.
     */
    MATERIALIZED,
    /**
     * Pull rows on demand while holding the read transaction until the iterator is closed.
     */
    STREAMING
}
